package com.convkit.shared.error;

/**
 * Root of every failure reported by the client. Each call fails independently;
 * none of these leave the client instance unusable.
 */
public class ConversationException extends RuntimeException {

    public ConversationException(String message) {
        super(message);
    }

    public ConversationException(String message, Throwable cause) {
        super(message, cause);
    }
}
