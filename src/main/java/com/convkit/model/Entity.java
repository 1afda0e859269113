package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record Entity(
        String entity,
        String created,
        String updated,
        String description,
        Map<String, JsonNode> metadata,
        Boolean fuzzyMatch
) {

    private static final Field<Entity, String> ENTITY =
            Field.required("entity", FieldTypes.STRING, Entity::entity);
    private static final Field<Entity, String> CREATED =
            Field.optional("created", FieldTypes.STRING, Entity::created);
    private static final Field<Entity, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, Entity::updated);
    private static final Field<Entity, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, Entity::description);
    private static final Field<Entity, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, Entity::metadata);
    private static final Field<Entity, Boolean> FUZZY_MATCH =
            Field.optional("fuzzy_match", FieldTypes.BOOLEAN, Entity::fuzzyMatch);

    public static final RecordSchema<Entity> SCHEMA = RecordSchema.builder(Entity.class)
            .field(ENTITY)
            .field(CREATED)
            .field(UPDATED)
            .field(DESCRIPTION)
            .field(METADATA)
            .field(FUZZY_MATCH)
            .build(v -> new Entity(
                    v.get(ENTITY),
                    v.get(CREATED),
                    v.get(UPDATED),
                    v.get(DESCRIPTION),
                    v.get(METADATA),
                    v.get(FUZZY_MATCH)));

    public Entity {
        metadata = ModelSupport.json(metadata);
    }
}
