package com.convkit.shared.error;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

public class DecodeException extends ConversationException {

    public enum Kind {
        MISSING_REQUIRED_FIELD,
        WRONG_TYPE,
        MALFORMED_JSON,
        EMPTY_BODY
    }

    private final Kind kind;
    private final String path;

    public DecodeException(Kind kind, String path, String message) {
        super(path + ": " + message);
        this.kind = kind;
        this.path = path;
    }

    public DecodeException(Kind kind, String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.kind = kind;
        this.path = path;
    }

    public static DecodeException missing(String path) {
        return new DecodeException(Kind.MISSING_REQUIRED_FIELD, path, "required field is missing");
    }

    public static DecodeException wrongType(String path, String expected, Object actual) {
        return new DecodeException(Kind.WRONG_TYPE, path,
                "expected " + expected + " but found " + describe(actual));
    }

    public Kind kind() { return kind; }

    public String path() { return path; }

    private static String describe(Object actual) {
        if (actual == null) return "nothing";
        if (actual instanceof JsonNode node) {
            return node.getNodeType().name().toLowerCase(Locale.ROOT);
        }
        return actual.getClass().getSimpleName();
    }
}
