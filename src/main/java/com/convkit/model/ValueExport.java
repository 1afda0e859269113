package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record ValueExport(
        String value,
        Map<String, JsonNode> metadata,
        String created,
        String updated,
        List<String> synonyms
) {

    private static final Field<ValueExport, String> VALUE =
            Field.required("value", FieldTypes.STRING, ValueExport::value);
    private static final Field<ValueExport, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, ValueExport::metadata);
    private static final Field<ValueExport, String> CREATED =
            Field.optional("created", FieldTypes.STRING, ValueExport::created);
    private static final Field<ValueExport, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, ValueExport::updated);
    private static final Field<ValueExport, List<String>> SYNONYMS =
            Field.optional("synonyms", FieldTypes.listOf(FieldTypes.STRING), ValueExport::synonyms);

    public static final RecordSchema<ValueExport> SCHEMA = RecordSchema.builder(ValueExport.class)
            .field(VALUE)
            .field(METADATA)
            .field(CREATED)
            .field(UPDATED)
            .field(SYNONYMS)
            .build(v -> new ValueExport(
                    v.get(VALUE),
                    v.get(METADATA),
                    v.get(CREATED),
                    v.get(UPDATED),
                    v.get(SYNONYMS)));

    public ValueExport {
        metadata = ModelSupport.json(metadata);
        synonyms = ModelSupport.list(synonyms);
    }
}
