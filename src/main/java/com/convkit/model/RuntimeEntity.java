package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/** An entity value recognized in the user input; {@code location} holds start and end offsets. */
public record RuntimeEntity(
        String entity,
        List<Integer> location,
        String value,
        Double confidence,
        Map<String, JsonNode> metadata,
        Map<String, JsonNode> additionalProperties
) {

    private static final Field<RuntimeEntity, String> ENTITY =
            Field.required("entity", FieldTypes.STRING, RuntimeEntity::entity);
    private static final Field<RuntimeEntity, List<Integer>> LOCATION =
            Field.required("location", FieldTypes.listOf(FieldTypes.INT), RuntimeEntity::location);
    private static final Field<RuntimeEntity, String> VALUE =
            Field.required("value", FieldTypes.STRING, RuntimeEntity::value);
    private static final Field<RuntimeEntity, Double> CONFIDENCE =
            Field.optional("confidence", FieldTypes.DOUBLE, RuntimeEntity::confidence);
    private static final Field<RuntimeEntity, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, RuntimeEntity::metadata);

    public static final RecordSchema<RuntimeEntity> SCHEMA = RecordSchema.builder(RuntimeEntity.class)
            .field(ENTITY)
            .field(LOCATION)
            .field(VALUE)
            .field(CONFIDENCE)
            .field(METADATA)
            .extensions(RuntimeEntity::additionalProperties)
            .build(v -> new RuntimeEntity(
                    v.get(ENTITY),
                    v.get(LOCATION),
                    v.get(VALUE),
                    v.get(CONFIDENCE),
                    v.get(METADATA),
                    v.extensions()));

    public RuntimeEntity {
        location = ModelSupport.list(location);
        metadata = ModelSupport.json(metadata);
        additionalProperties = ModelSupport.bag(additionalProperties);
    }

    public RuntimeEntity(String entity, List<Integer> location, String value) {
        this(entity, location, value, null, null, Map.of());
    }
}
