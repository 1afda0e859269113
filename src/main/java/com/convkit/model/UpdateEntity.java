package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record UpdateEntity(
        String entity,
        String description,
        Map<String, JsonNode> metadata,
        Boolean fuzzyMatch,
        List<CreateValue> values
) {

    private static final Field<UpdateEntity, String> ENTITY =
            Field.optional("entity", FieldTypes.STRING, UpdateEntity::entity);
    private static final Field<UpdateEntity, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, UpdateEntity::description);
    private static final Field<UpdateEntity, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, UpdateEntity::metadata);
    private static final Field<UpdateEntity, Boolean> FUZZY_MATCH =
            Field.optional("fuzzy_match", FieldTypes.BOOLEAN, UpdateEntity::fuzzyMatch);
    private static final Field<UpdateEntity, List<CreateValue>> VALUES =
            Field.optional("values", FieldTypes.listOf(CreateValue.SCHEMA), UpdateEntity::values);

    public static final RecordSchema<UpdateEntity> SCHEMA = RecordSchema.builder(UpdateEntity.class)
            .field(ENTITY)
            .field(DESCRIPTION)
            .field(METADATA)
            .field(FUZZY_MATCH)
            .field(VALUES)
            .build(v -> new UpdateEntity(
                    v.get(ENTITY),
                    v.get(DESCRIPTION),
                    v.get(METADATA),
                    v.get(FUZZY_MATCH),
                    v.get(VALUES)));

    public UpdateEntity {
        metadata = ModelSupport.json(metadata);
        values = ModelSupport.list(values);
    }
}
