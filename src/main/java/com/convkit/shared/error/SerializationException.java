package com.convkit.shared.error;

/** A request body could not be encoded or written as JSON. Raised before any I/O. */
public class SerializationException extends ConversationException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
