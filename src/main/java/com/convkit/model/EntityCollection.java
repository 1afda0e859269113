package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record EntityCollection(List<EntityExport> entities, Pagination pagination) {

    private static final Field<EntityCollection, List<EntityExport>> ENTITIES =
            Field.required("entities", FieldTypes.listOf(EntityExport.SCHEMA), EntityCollection::entities);
    private static final Field<EntityCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, EntityCollection::pagination);

    public static final RecordSchema<EntityCollection> SCHEMA = RecordSchema.builder(EntityCollection.class)
            .field(ENTITIES)
            .field(PAGINATION)
            .build(v -> new EntityCollection(v.get(ENTITIES), v.get(PAGINATION)));

    public EntityCollection {
        entities = ModelSupport.list(entities);
    }
}
