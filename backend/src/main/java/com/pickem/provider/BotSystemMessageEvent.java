package com.pickem.provider;

/**
 * Raised by a platform client when the platform posted a notice for one of the bot's actions.
 */
public record BotSystemMessageEvent(long channelId, long messageId, SystemMessageType type) {
}
