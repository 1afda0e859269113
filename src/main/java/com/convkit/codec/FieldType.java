package com.convkit.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts between one JSON node and a Java value.
 * {@link #decode} is never handed a missing node or a JSON {@code null};
 * {@link #encode} is never handed a Java {@code null}.
 */
public interface FieldType<V> {

    V decode(JsonNode node, String path);

    JsonNode encode(V value);
}
