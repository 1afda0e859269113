package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record UpdateValue(
        String value,
        Map<String, JsonNode> metadata,
        List<String> synonyms
) {

    private static final Field<UpdateValue, String> VALUE =
            Field.optional("value", FieldTypes.STRING, UpdateValue::value);
    private static final Field<UpdateValue, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, UpdateValue::metadata);
    private static final Field<UpdateValue, List<String>> SYNONYMS =
            Field.optional("synonyms", FieldTypes.listOf(FieldTypes.STRING), UpdateValue::synonyms);

    public static final RecordSchema<UpdateValue> SCHEMA = RecordSchema.builder(UpdateValue.class)
            .field(VALUE)
            .field(METADATA)
            .field(SYNONYMS)
            .build(v -> new UpdateValue(v.get(VALUE), v.get(METADATA), v.get(SYNONYMS)));

    public UpdateValue {
        metadata = ModelSupport.json(metadata);
        synonyms = ModelSupport.list(synonyms);
    }
}
