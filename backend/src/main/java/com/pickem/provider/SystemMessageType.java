package com.pickem.provider;

/**
 * Kind of notice the platform posts on its own after one of the bot's actions.
 */
public enum SystemMessageType {
    POLL_RESULT,
    PINS_ADD,
    DEFAULT
}
