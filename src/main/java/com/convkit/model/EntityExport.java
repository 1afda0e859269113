package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record EntityExport(
        String entity,
        String created,
        String updated,
        String description,
        Map<String, JsonNode> metadata,
        Boolean fuzzyMatch,
        List<ValueExport> values
) {

    private static final Field<EntityExport, String> ENTITY =
            Field.required("entity", FieldTypes.STRING, EntityExport::entity);
    private static final Field<EntityExport, String> CREATED =
            Field.optional("created", FieldTypes.STRING, EntityExport::created);
    private static final Field<EntityExport, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, EntityExport::updated);
    private static final Field<EntityExport, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, EntityExport::description);
    private static final Field<EntityExport, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, EntityExport::metadata);
    private static final Field<EntityExport, Boolean> FUZZY_MATCH =
            Field.optional("fuzzy_match", FieldTypes.BOOLEAN, EntityExport::fuzzyMatch);
    private static final Field<EntityExport, List<ValueExport>> VALUES =
            Field.optional("values", FieldTypes.listOf(ValueExport.SCHEMA), EntityExport::values);

    public static final RecordSchema<EntityExport> SCHEMA = RecordSchema.builder(EntityExport.class)
            .field(ENTITY)
            .field(CREATED)
            .field(UPDATED)
            .field(DESCRIPTION)
            .field(METADATA)
            .field(FUZZY_MATCH)
            .field(VALUES)
            .build(v -> new EntityExport(
                    v.get(ENTITY),
                    v.get(CREATED),
                    v.get(UPDATED),
                    v.get(DESCRIPTION),
                    v.get(METADATA),
                    v.get(FUZZY_MATCH),
                    v.get(VALUES)));

    public EntityExport {
        metadata = ModelSupport.json(metadata);
        values = ModelSupport.list(values);
    }
}
