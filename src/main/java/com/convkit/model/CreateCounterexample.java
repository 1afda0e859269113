package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record CreateCounterexample(String text) {

    private static final Field<CreateCounterexample, String> TEXT =
            Field.required("text", FieldTypes.STRING, CreateCounterexample::text);

    public static final RecordSchema<CreateCounterexample> SCHEMA = RecordSchema.builder(CreateCounterexample.class)
            .field(TEXT)
            .build(v -> new CreateCounterexample(v.get(TEXT)));
}
