package com.pickem.service;

import com.pickem.model.Channel;
import com.pickem.model.Game;
import com.pickem.model.Outcome;
import com.pickem.model.Team;
import com.pickem.provider.ChatPlatformClient;
import com.pickem.provider.ChatPlatformClient.PollMessage;
import com.pickem.provider.ChatPlatformClient.PollOption;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the text of poll, result, announcement and leaderboard messages.
 */
@Component
@RequiredArgsConstructor
public class PollMessageRenderer {

    static final String TIE_EMOJI = "🤝";
    static final String NOBODY_CORRECT = "nobody......... What is wrong with you guys?!";
    private static final DateTimeFormatter KICKOFF_FORMAT = DateTimeFormatter.ofPattern("EEE, MMM d yyyy HH:mm 'UTC'", Locale.ENGLISH);

    private final ChatPlatformClient chatPlatformClient;

    public PollMessage renderPoll(
            Channel channel,
            Game game,
            Team homeTeam,
            Team awayTeam,
            String gameTypeName,
            int scalingFactor,
            Duration duration
    ) {
        String homeEmoji = chatPlatformClient.renderEmoji(homeTeam.getEmojiId(), homeTeam.getId());
        String awayEmoji = chatPlatformClient.renderEmoji(awayTeam.getEmojiId(), awayTeam.getId());

        List<PollOption> options = new ArrayList<>();
        for (Outcome outcome : PollOptions.forGameType(game.getGameTypeId())) {
            switch (outcome) {
                case HOME -> options.add(new PollOption(homeTeam.getName(), homeEmoji));
                case AWAY -> options.add(new PollOption(awayTeam.getName(), awayEmoji));
                case TIE -> options.add(new PollOption("Tie", TIE_EMOJI));
                default -> throw new IllegalStateException("Unexpected poll option " + outcome);
            }
        }

        StringBuilder content = new StringBuilder();
        content.append("# ").append(homeEmoji).append(' ').append(homeTeam.getName())
                .append(" - ").append(awayTeam.getName()).append(' ').append(awayEmoji);
        content.append("\n### ").append(gameTypeName)
                .append(" (Grants you ").append(pointsLabel(scalingFactor)).append(')');
        content.append("\n### Kickoff: ").append(KICKOFF_FORMAT.format(game.getKickoff().withOffsetSameInstant(ZoneOffset.UTC)));
        content.append("\n-# Polls may close early, so don't vote on the last second");

        return new PollMessage(
                channel.getId(),
                content.toString(),
                homeTeam.getName() + " - " + awayTeam.getName(),
                options,
                duration
        );
    }

    public String renderAnnouncement(Channel channel) {
        String mention = channel.getRoleId() != null ? " <@&" + channel.getRoleId() + ">" : "";
        return "New polls are incoming! Good luck everybody" + mention;
    }

    /**
     * @param correctPredictors rendered mentions of users whose choice matched the outcome
     */
    public String renderResult(
            Game game,
            Team homeTeam,
            Team awayTeam,
            String gameTypeName,
            int scalingFactor,
            List<String> correctPredictors
    ) {
        String homeEmoji = chatPlatformClient.renderEmoji(homeTeam.getEmojiId(), homeTeam.getId());
        String awayEmoji = chatPlatformClient.renderEmoji(awayTeam.getEmojiId(), awayTeam.getId());

        StringBuilder content = new StringBuilder("**Final Score**");
        content.append("\n").append(gameTypeName).append(" (").append(pointsLabel(scalingFactor)).append(')');
        content.append("\n").append(homeEmoji).append(' ').append(homeTeam.getName()).append(": ").append(game.getHomeScore());
        content.append("\n").append(awayEmoji).append(' ').append(awayTeam.getName()).append(": ").append(game.getAwayScore());
        content.append("\n---------\n");
        if (correctPredictors.isEmpty()) {
            content.append(NOBODY_CORRECT);
        } else {
            content.append("GG ").append(String.join(", ", correctPredictors));
        }
        return content.toString();
    }

    /**
     * Renders the first {@code topPlaces} places individually and everything below as "The Rest".
     */
    public String renderLeaderboard(List<LeaderboardPlacement> placements, Map<Long, String> displayNames, int topPlaces) {
        StringBuilder content = new StringBuilder("**Leaderboard**");
        if (placements.isEmpty()) {
            return content.append("\n> ---").toString();
        }
        List<String> rest = new ArrayList<>();
        for (LeaderboardPlacement placement : placements) {
            List<String> lines = new ArrayList<>();
            for (Long userId : placement.userIds()) {
                String name = displayNames.getOrDefault(userId, String.valueOf(userId));
                lines.add("> " + (placement.place() > topPlaces ? "`" + placement.place() + ".` " : "")
                        + name + ": " + placement.score());
            }
            if (placement.place() > topPlaces) {
                rest.addAll(lines);
                continue;
            }
            content.append("\n").append(placeLabel(placement.place())).append("\n").append(String.join("\n", lines));
        }
        if (!rest.isEmpty()) {
            content.append("\nThe Rest\n").append(String.join("\n", rest));
        }
        return content.toString();
    }

    static String placeLabel(int place) {
        int lastTwo = place % 100;
        String suffix;
        if (lastTwo >= 11 && lastTwo <= 13) {
            suffix = "th";
        } else {
            suffix = switch (place % 10) {
                case 1 -> "st";
                case 2 -> "nd";
                case 3 -> "rd";
                default -> "th";
            };
        }
        return place + suffix + " Place";
    }

    static String pointsLabel(int factor) {
        return factor + (factor == 1 ? " point" : " points");
    }
}
