package com.convkit.shared.error;

public class EncodeException extends ConversationException {

    public enum Kind {
        DUPLICATE_KEY,
        MISSING_REQUIRED_FIELD
    }

    private final Kind kind;
    private final String path;

    public EncodeException(Kind kind, String path, String message) {
        super(path + ": " + message);
        this.kind = kind;
        this.path = path;
    }

    public static EncodeException duplicateKey(String path) {
        return new EncodeException(Kind.DUPLICATE_KEY, path,
                "additional property collides with a known field");
    }

    public static EncodeException missing(String path) {
        return new EncodeException(Kind.MISSING_REQUIRED_FIELD, path, "required field has no value");
    }

    public Kind kind() { return kind; }

    public String path() { return path; }
}
