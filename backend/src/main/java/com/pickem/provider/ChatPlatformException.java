package com.pickem.provider;

/**
 * Transient failure talking to the chat platform. Callers retry on the next cycle.
 */
public class ChatPlatformException extends RuntimeException {

    public ChatPlatformException(String message) {
        super(message);
    }

    public ChatPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
