package com.convkit.shared.error;

/** A path or query value could not be percent-encoded. Raised before any I/O. */
public class EncodingException extends ConversationException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
