package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record Value(
        String value,
        Map<String, JsonNode> metadata,
        String created,
        String updated
) {

    private static final Field<Value, String> VALUE =
            Field.required("value", FieldTypes.STRING, Value::value);
    private static final Field<Value, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, Value::metadata);
    private static final Field<Value, String> CREATED =
            Field.optional("created", FieldTypes.STRING, Value::created);
    private static final Field<Value, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, Value::updated);

    public static final RecordSchema<Value> SCHEMA = RecordSchema.builder(Value.class)
            .field(VALUE)
            .field(METADATA)
            .field(CREATED)
            .field(UPDATED)
            .build(v -> new Value(v.get(VALUE), v.get(METADATA), v.get(CREATED), v.get(UPDATED)));

    public Value {
        metadata = ModelSupport.json(metadata);
    }
}
