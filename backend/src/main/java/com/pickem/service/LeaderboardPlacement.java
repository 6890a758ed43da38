package com.pickem.service;

import java.util.List;

/**
 * One rank on a channel leaderboard. Users sharing a score share the place.
 */
public record LeaderboardPlacement(int place, int score, List<Long> userIds) {
}
