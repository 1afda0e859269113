package com.convkit.codec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** Decoded known-field values plus the extension bag, handed to a record factory. */
public final class FieldValues {

    private final Map<Field<?, ?>, Object> values;
    private final Map<String, JsonNode> extensions;

    FieldValues(Map<Field<?, ?>, Object> values, Map<String, JsonNode> extensions) {
        this.values = values;
        this.extensions = extensions;
    }

    /** The decoded value, or {@code null} when an optional field was absent. */
    @SuppressWarnings("unchecked")
    public <V> V get(Field<?, V> field) {
        return (V) values.get(field);
    }

    public Map<String, JsonNode> extensions() {
        return extensions;
    }
}
