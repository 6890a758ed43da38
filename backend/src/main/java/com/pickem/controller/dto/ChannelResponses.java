package com.pickem.controller.dto;

import com.pickem.model.Channel;
import com.pickem.model.GameTypeScaling;
import com.pickem.service.LeaderboardPlacement;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public final class ChannelResponses {

    private ChannelResponses() {
    }

    public record ChannelSummary(
            Long id,
            String name,
            Long roleId,
            boolean active,
            boolean deleteResultMessage,
            Long leaderboardMessageId,
            OffsetDateTime updatedAt
    ) {
        public static ChannelSummary from(Channel channel) {
            return new ChannelSummary(
                    channel.getId(),
                    channel.getName(),
                    channel.getRoleId(),
                    channel.isActive(),
                    channel.isDeleteResultMessage(),
                    channel.getLeaderboardMessageId(),
                    channel.getUpdatedAt()
            );
        }
    }

    public record ScalingSummary(Long channelId, String gameTypeId, int factor) {
        public static ScalingSummary from(GameTypeScaling scaling) {
            return new ScalingSummary(scaling.getChannelId(), scaling.getGameTypeId(), scaling.getFactor());
        }
    }

    public record LeaderboardRow(int place, int score, List<LeaderboardUser> users) {
    }

    public record LeaderboardUser(Long userId, String username) {
    }

    public record Leaderboard(Long channelId, List<LeaderboardRow> rows) {
        public static Leaderboard from(Long channelId, List<LeaderboardPlacement> placements, Map<Long, String> names) {
            List<LeaderboardRow> rows = placements.stream()
                    .map(placement -> new LeaderboardRow(
                            placement.place(),
                            placement.score(),
                            placement.userIds().stream()
                                    .map(userId -> new LeaderboardUser(userId, names.get(userId)))
                                    .toList()))
                    .toList();
            return new Leaderboard(channelId, rows);
        }
    }
}
