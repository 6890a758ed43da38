package com.pickem.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local chat platform used for local runs and tests.
 * Messages and votes live in memory; votes are injected through {@link #castVote}.
 * Ending a poll and pinning a message leave a notice in the channel, like the real platform does.
 */
@Component
public class InMemoryChatPlatformClient implements ChatPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChatPlatformClient.class);

    private final AtomicLong idSequence = new AtomicLong(1_000);
    private final Map<Long, StoredMessage> messages = new ConcurrentHashMap<>();
    private final Map<Long, Map<Long, ObservedVote>> votesByMessage = new ConcurrentHashMap<>();
    private final Map<String, Long> emojis = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;

    public InMemoryChatPlatformClient(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public long publishPoll(PollMessage pollMessage) {
        long messageId = store(pollMessage.channelId(), pollMessage.content(), null, pollMessage);
        log.debug("Published poll {} in channel {}: {}", messageId, pollMessage.channelId(), pollMessage.question());
        return messageId;
    }

    @Override
    public void closePoll(long channelId, long messageId) {
        StoredMessage message = requireMessage(channelId, messageId);
        if (message.poll() == null) {
            throw new ChatPlatformException("Message " + messageId + " is not a poll");
        }
        if (message.pollClosed()) {
            return;
        }
        messages.put(messageId, message.withPollClosed());
        postNotice(channelId, "The poll has ended", SystemMessageType.POLL_RESULT);
    }

    @Override
    public List<ObservedVote> fetchCurrentVoters(long channelId, long messageId) {
        requireMessage(channelId, messageId);
        return new ArrayList<>(votesByMessage.getOrDefault(messageId, Map.of()).values());
    }

    @Override
    public long sendMessage(long channelId, String content) {
        return store(channelId, content, null, null);
    }

    @Override
    public long replyToMessage(long channelId, long messageId, String content) {
        requireMessage(channelId, messageId);
        return store(channelId, content, messageId, null);
    }

    @Override
    public void editMessage(long channelId, long messageId, String content) {
        StoredMessage message = requireMessage(channelId, messageId);
        messages.put(messageId, message.withContent(content));
    }

    @Override
    public void deleteMessage(long channelId, long messageId) {
        requireMessage(channelId, messageId);
        messages.remove(messageId);
        votesByMessage.remove(messageId);
    }

    @Override
    public void pinMessage(long channelId, long messageId) {
        StoredMessage message = requireMessage(channelId, messageId);
        if (message.pinned()) {
            return;
        }
        messages.put(messageId, message.withPinned(true));
        postNotice(channelId, "A message was pinned to this channel", SystemMessageType.PINS_ADD);
    }

    @Override
    public void unpinMessage(long channelId, long messageId) {
        StoredMessage message = requireMessage(channelId, messageId);
        messages.put(messageId, message.withPinned(false));
    }

    @Override
    public String mentionUser(long userId, String fallbackName) {
        return "<@" + userId + ">";
    }

    @Override
    public Optional<Long> findApplicationEmoji(String name) {
        return Optional.ofNullable(emojis.get(name));
    }

    @Override
    public long createApplicationEmoji(String name, String imageUrl) {
        return emojis.computeIfAbsent(name, ignored -> idSequence.incrementAndGet());
    }

    @Override
    public String renderEmoji(Long emojiId, String name) {
        if (emojiId == null) {
            return ":" + name + ":";
        }
        return "<:" + name + ":" + emojiId + ">";
    }

    /**
     * Records a vote, replacing any earlier vote by the same user on that poll.
     */
    public void castVote(long messageId, long userId, String username, int optionIndex) {
        StoredMessage message = messages.get(messageId);
        if (message == null || message.poll() == null) {
            throw new IllegalArgumentException("No poll message " + messageId);
        }
        if (message.pollClosed()) {
            throw new IllegalStateException("Poll " + messageId + " is closed");
        }
        votesByMessage.computeIfAbsent(messageId, ignored -> new ConcurrentHashMap<>())
                .put(userId, new ObservedVote(userId, username, optionIndex));
    }

    public void retractVote(long messageId, long userId) {
        Map<Long, ObservedVote> votes = votesByMessage.get(messageId);
        if (votes != null) {
            votes.remove(userId);
        }
    }

    public Optional<StoredMessage> findMessage(long messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    public List<StoredMessage> messagesInChannel(long channelId) {
        return messages.values().stream()
                .filter(message -> message.channelId() == channelId)
                .sorted((a, b) -> Long.compare(a.messageId(), b.messageId()))
                .toList();
    }

    private long store(long channelId, String content, Long replyTo, PollMessage poll) {
        return store(new StoredMessage(idSequence.incrementAndGet(), channelId, content, replyTo, poll,
                false, false, SystemMessageType.DEFAULT));
    }

    private long store(StoredMessage message) {
        messages.put(message.messageId(), message);
        return message.messageId();
    }

    private void postNotice(long channelId, String content, SystemMessageType type) {
        long noticeId = store(new StoredMessage(idSequence.incrementAndGet(), channelId, content, null, null,
                false, false, type));
        log.debug("Posted {} notice {} in channel {}", type, noticeId, channelId);
        eventPublisher.publishEvent(new BotSystemMessageEvent(channelId, noticeId, type));
    }

    private StoredMessage requireMessage(long channelId, long messageId) {
        StoredMessage message = messages.get(messageId);
        if (message == null || message.channelId() != channelId) {
            throw new ChatPlatformException("Unknown message " + messageId + " in channel " + channelId);
        }
        return message;
    }

    public record StoredMessage(
            long messageId,
            long channelId,
            String content,
            Long replyTo,
            PollMessage poll,
            boolean pollClosed,
            boolean pinned,
            SystemMessageType type
    ) {
        StoredMessage withContent(String newContent) {
            return new StoredMessage(messageId, channelId, newContent, replyTo, poll, pollClosed, pinned, type);
        }

        StoredMessage withPollClosed() {
            return new StoredMessage(messageId, channelId, content, replyTo, poll, true, pinned, type);
        }

        StoredMessage withPinned(boolean nowPinned) {
            return new StoredMessage(messageId, channelId, content, replyTo, poll, pollClosed, nowPinned, type);
        }
    }
}
