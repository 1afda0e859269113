package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record ValueCollection(List<ValueExport> values, Pagination pagination) {

    private static final Field<ValueCollection, List<ValueExport>> VALUES =
            Field.required("values", FieldTypes.listOf(ValueExport.SCHEMA), ValueCollection::values);
    private static final Field<ValueCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, ValueCollection::pagination);

    public static final RecordSchema<ValueCollection> SCHEMA = RecordSchema.builder(ValueCollection.class)
            .field(VALUES)
            .field(PAGINATION)
            .build(v -> new ValueCollection(v.get(VALUES), v.get(PAGINATION)));

    public ValueCollection {
        values = ModelSupport.list(values);
    }
}
