package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** The user input of one message exchange. */
public record InputData(String text, Map<String, JsonNode> additionalProperties) {

    private static final Field<InputData, String> TEXT =
            Field.required("text", FieldTypes.STRING, InputData::text);

    public static final RecordSchema<InputData> SCHEMA = RecordSchema.builder(InputData.class)
            .field(TEXT)
            .extensions(InputData::additionalProperties)
            .build(v -> new InputData(v.get(TEXT), v.extensions()));

    public InputData {
        additionalProperties = ModelSupport.bag(additionalProperties);
    }

    public InputData(String text) {
        this(text, Map.of());
    }
}
