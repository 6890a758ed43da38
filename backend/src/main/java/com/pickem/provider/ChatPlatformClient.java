package com.pickem.provider;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Chat platform operations the poll workflow depends on.
 * Every method may throw {@link ChatPlatformException} on a transient failure.
 * Notices the platform posts in reaction to the bot's own actions are announced
 * as {@link BotSystemMessageEvent}s.
 */
public interface ChatPlatformClient {

    /**
     * Posts a poll message and returns its handle.
     */
    long publishPoll(PollMessage pollMessage);

    /**
     * Ends voting on a previously published poll.
     */
    void closePoll(long channelId, long messageId);

    /**
     * Current voters of a published poll, one entry per (voter, chosen option).
     */
    List<ObservedVote> fetchCurrentVoters(long channelId, long messageId);

    long sendMessage(long channelId, String content);

    long replyToMessage(long channelId, long messageId, String content);

    void editMessage(long channelId, long messageId, String content);

    void deleteMessage(long channelId, long messageId);

    void pinMessage(long channelId, long messageId);

    void unpinMessage(long channelId, long messageId);

    /**
     * Renders a user mention, or the stored name when the platform cannot resolve the user.
     */
    String mentionUser(long userId, String fallbackName);

    Optional<Long> findApplicationEmoji(String name);

    long createApplicationEmoji(String name, String imageUrl);

    /**
     * Inline emoji markup for message bodies.
     */
    String renderEmoji(Long emojiId, String name);

    record PollMessage(
            long channelId,
            String content,
            String question,
            List<PollOption> options,
            Duration duration
    ) {
    }

    record PollOption(String text, String emoji) {
    }

    record ObservedVote(long userId, String username, int optionIndex) {
    }
}
