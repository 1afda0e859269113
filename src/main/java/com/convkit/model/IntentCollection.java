package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record IntentCollection(List<IntentExport> intents, Pagination pagination) {

    private static final Field<IntentCollection, List<IntentExport>> INTENTS =
            Field.required("intents", FieldTypes.listOf(IntentExport.SCHEMA), IntentCollection::intents);
    private static final Field<IntentCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, IntentCollection::pagination);

    public static final RecordSchema<IntentCollection> SCHEMA = RecordSchema.builder(IntentCollection.class)
            .field(INTENTS)
            .field(PAGINATION)
            .build(v -> new IntentCollection(v.get(INTENTS), v.get(PAGINATION)));

    public IntentCollection {
        intents = ModelSupport.list(intents);
    }
}
