package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record CreateValue(
        String value,
        Map<String, JsonNode> metadata,
        List<String> synonyms
) {

    private static final Field<CreateValue, String> VALUE =
            Field.required("value", FieldTypes.STRING, CreateValue::value);
    private static final Field<CreateValue, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, CreateValue::metadata);
    private static final Field<CreateValue, List<String>> SYNONYMS =
            Field.optional("synonyms", FieldTypes.listOf(FieldTypes.STRING), CreateValue::synonyms);

    public static final RecordSchema<CreateValue> SCHEMA = RecordSchema.builder(CreateValue.class)
            .field(VALUE)
            .field(METADATA)
            .field(SYNONYMS)
            .build(v -> new CreateValue(v.get(VALUE), v.get(METADATA), v.get(SYNONYMS)));

    public CreateValue {
        metadata = ModelSupport.json(metadata);
        synonyms = ModelSupport.list(synonyms);
    }

    public CreateValue(String value, List<String> synonyms) {
        this(value, null, synonyms);
    }
}
