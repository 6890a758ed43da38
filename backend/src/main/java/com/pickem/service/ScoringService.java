package com.pickem.service;

import com.pickem.model.Game;
import com.pickem.model.GameTypeScaling;
import com.pickem.model.GameTypeScalingId;
import com.pickem.model.Wager;
import com.pickem.repository.GameRepository;
import com.pickem.repository.GameTypeScalingRepository;
import com.pickem.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes wager points and per-channel leaderboards.
 */
@Service
@RequiredArgsConstructor
public class ScoringService {

    private final WagerRepository wagerRepository;
    private final GameRepository gameRepository;
    private final GameTypeScalingRepository gameTypeScalingRepository;

    /**
     * Points a correct prediction on this game type is worth in the channel.
     * Defaults to {@link GameTypeScaling#DEFAULT_FACTOR} when no scaling row exists.
     */
    @Transactional(readOnly = true)
    public int scalingFactor(Long channelId, String gameTypeId) {
        return gameTypeScalingRepository.findById(new GameTypeScalingId(channelId, gameTypeId))
                .map(GameTypeScaling::getFactor)
                .orElse(GameTypeScaling.DEFAULT_FACTOR);
    }

    public static int earnedPoints(Wager wager, Game game, int scalingFactor) {
        if (!game.getOutcome().isFinal() || wager.getChoice() != game.getOutcome()) {
            return 0;
        }
        return scalingFactor;
    }

    @Transactional(readOnly = true)
    public int earnedPoints(Wager wager) {
        Game game = gameRepository.findById(wager.getGameId())
                .orElseThrow(() -> new IllegalStateException("Wager " + wager.getId() + " references unknown game " + wager.getGameId()));
        return earnedPoints(wager, game, scalingFactor(wager.getChannelId(), game.getGameTypeId()));
    }

    /**
     * Total points per user in a channel, including users whose wagers earned nothing yet.
     */
    @Transactional(readOnly = true)
    public Map<Long, Integer> userTotals(Long channelId) {
        List<Wager> wagers = wagerRepository.findByChannelId(channelId);
        if (wagers.isEmpty()) {
            return Map.of();
        }

        Set<String> gameIds = wagers.stream().map(Wager::getGameId).collect(Collectors.toSet());
        Map<String, Game> games = gameRepository.findAllById(gameIds).stream()
                .collect(Collectors.toMap(Game::getId, Function.identity()));
        Map<String, Integer> factors = gameTypeScalingRepository.findByChannelId(channelId).stream()
                .collect(Collectors.toMap(GameTypeScaling::getGameTypeId, GameTypeScaling::getFactor));

        Map<Long, Integer> totals = new HashMap<>();
        for (Wager wager : wagers) {
            Game game = games.get(wager.getGameId());
            int points = 0;
            if (game != null) {
                int factor = factors.getOrDefault(game.getGameTypeId(), GameTypeScaling.DEFAULT_FACTOR);
                points = earnedPoints(wager, game, factor);
            }
            totals.merge(wager.getUserId(), points, Integer::sum);
        }
        return totals;
    }

    @Transactional(readOnly = true)
    public List<LeaderboardPlacement> leaderboard(Long channelId) {
        return rank(userTotals(channelId));
    }

    /**
     * Ranks users by descending score. Tied users share a place and the next place
     * advances by the size of the tied group.
     */
    public static List<LeaderboardPlacement> rank(Map<Long, Integer> totals) {
        TreeMap<Integer, List<Long>> byScore = new TreeMap<>(Comparator.reverseOrder());
        totals.forEach((userId, score) -> byScore.computeIfAbsent(score, ignored -> new ArrayList<>()).add(userId));

        List<LeaderboardPlacement> placements = new ArrayList<>();
        int place = 1;
        for (Map.Entry<Integer, List<Long>> entry : byScore.entrySet()) {
            List<Long> userIds = entry.getValue().stream().sorted().toList();
            placements.add(new LeaderboardPlacement(place, entry.getKey(), userIds));
            place += userIds.size();
        }
        return placements;
    }
}
