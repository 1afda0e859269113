package com.convkit.shared.error;

/** Connection, TLS, timeout or interruption failure below the HTTP layer. */
public class TransportException extends ConversationException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
