package com.pickem.service;

import com.pickem.provider.BotSystemMessageEvent;
import com.pickem.provider.ChatPlatformClient;
import com.pickem.provider.SystemMessageType;
import com.pickem.repository.ChannelRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Removes the platform's automatic notices for the bot's own actions
 * (poll ended, message pinned) in channels that opted into cleanup.
 */
@Service
@RequiredArgsConstructor
public class SystemMessageJanitor {

    private static final Logger log = LoggerFactory.getLogger(SystemMessageJanitor.class);

    private final ChannelRepository channelRepository;
    private final ChatPlatformClient chatPlatformClient;

    @EventListener
    public void onSystemMessageEvent(BotSystemMessageEvent event) {
        try {
            onBotSystemMessage(event.channelId(), event.messageId(), event.type());
        } catch (RuntimeException e) {
            log.error("Cleanup of {} notice {} in channel {} failed", event.type(), event.messageId(), event.channelId(), e);
        }
    }

    /**
     * @return true when the message was deleted
     */
    public boolean onBotSystemMessage(long channelId, long messageId, SystemMessageType type) {
        if (type == SystemMessageType.DEFAULT) {
            return false;
        }
        boolean cleanupEnabled = channelRepository.findById(channelId)
                .map(channel -> channel.isDeleteResultMessage())
                .orElse(false);
        if (!cleanupEnabled) {
            return false;
        }
        try {
            chatPlatformClient.deleteMessage(channelId, messageId);
            log.debug("Deleted {} notice {} in channel {}", type, messageId, channelId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to delete {} notice {} in channel {}", type, messageId, channelId, e);
            return false;
        }
    }
}
