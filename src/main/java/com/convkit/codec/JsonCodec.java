package com.convkit.codec;

import com.convkit.shared.error.DecodeException;
import com.convkit.shared.error.EncodeException;
import com.convkit.shared.error.SerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/** Bytes and strings to records and back, through Jackson's tree model. */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonCodec() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static JsonNode readTree(byte[] bytes) {
        try {
            return MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_JSON, "$",
                    "body is not valid JSON: " + e.getMessage(), e);
        }
    }

    public static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_JSON, "$",
                    "text is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T decode(byte[] bytes, RecordSchema<T> schema) {
        return schema.decode(readTree(bytes));
    }

    public static <T> T decode(String json, RecordSchema<T> schema) {
        return schema.decode(readTree(json));
    }

    public static <T> ObjectNode encode(T record, RecordSchema<T> schema) {
        return schema.encode(record);
    }

    public static <T> byte[] toBytes(T record, RecordSchema<T> schema) {
        try {
            return MAPPER.writeValueAsBytes(schema.encode(record));
        } catch (EncodeException e) {
            throw new SerializationException("Cannot encode " + schema.name() + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize " + schema.name(), e);
        }
    }

    public static <T> String toJson(T record, RecordSchema<T> schema) {
        return new String(toBytes(record, schema), StandardCharsets.UTF_8);
    }
}
