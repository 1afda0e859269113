package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record CreateEntity(
        String entity,
        String description,
        Map<String, JsonNode> metadata,
        List<CreateValue> values,
        Boolean fuzzyMatch
) {

    private static final Field<CreateEntity, String> ENTITY =
            Field.required("entity", FieldTypes.STRING, CreateEntity::entity);
    private static final Field<CreateEntity, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, CreateEntity::description);
    private static final Field<CreateEntity, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, CreateEntity::metadata);
    private static final Field<CreateEntity, List<CreateValue>> VALUES =
            Field.optional("values", FieldTypes.listOf(CreateValue.SCHEMA), CreateEntity::values);
    private static final Field<CreateEntity, Boolean> FUZZY_MATCH =
            Field.optional("fuzzy_match", FieldTypes.BOOLEAN, CreateEntity::fuzzyMatch);

    public static final RecordSchema<CreateEntity> SCHEMA = RecordSchema.builder(CreateEntity.class)
            .field(ENTITY)
            .field(DESCRIPTION)
            .field(METADATA)
            .field(VALUES)
            .field(FUZZY_MATCH)
            .build(v -> new CreateEntity(
                    v.get(ENTITY),
                    v.get(DESCRIPTION),
                    v.get(METADATA),
                    v.get(VALUES),
                    v.get(FUZZY_MATCH)));

    public CreateEntity {
        metadata = ModelSupport.json(metadata);
        values = ModelSupport.list(values);
    }

    public CreateEntity(String entity, List<CreateValue> values) {
        this(entity, null, null, values, null);
    }
}
