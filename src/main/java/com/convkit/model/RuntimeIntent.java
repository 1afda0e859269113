package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record RuntimeIntent(
        String intent,
        Double confidence,
        Map<String, JsonNode> additionalProperties
) {

    private static final Field<RuntimeIntent, String> INTENT =
            Field.required("intent", FieldTypes.STRING, RuntimeIntent::intent);
    private static final Field<RuntimeIntent, Double> CONFIDENCE =
            Field.required("confidence", FieldTypes.DOUBLE, RuntimeIntent::confidence);

    public static final RecordSchema<RuntimeIntent> SCHEMA = RecordSchema.builder(RuntimeIntent.class)
            .field(INTENT)
            .field(CONFIDENCE)
            .extensions(RuntimeIntent::additionalProperties)
            .build(v -> new RuntimeIntent(v.get(INTENT), v.get(CONFIDENCE), v.extensions()));

    public RuntimeIntent {
        additionalProperties = ModelSupport.bag(additionalProperties);
    }

    public RuntimeIntent(String intent, Double confidence) {
        this(intent, confidence, Map.of());
    }
}
