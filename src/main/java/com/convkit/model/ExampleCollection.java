package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record ExampleCollection(List<Example> examples, Pagination pagination) {

    private static final Field<ExampleCollection, List<Example>> EXAMPLES =
            Field.required("examples", FieldTypes.listOf(Example.SCHEMA), ExampleCollection::examples);
    private static final Field<ExampleCollection, Pagination> PAGINATION =
            Field.required("pagination", Pagination.SCHEMA, ExampleCollection::pagination);

    public static final RecordSchema<ExampleCollection> SCHEMA = RecordSchema.builder(ExampleCollection.class)
            .field(EXAMPLES)
            .field(PAGINATION)
            .build(v -> new ExampleCollection(v.get(EXAMPLES), v.get(PAGINATION)));

    public ExampleCollection {
        examples = ModelSupport.list(examples);
    }
}
