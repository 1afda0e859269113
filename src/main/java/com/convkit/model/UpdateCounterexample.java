package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record UpdateCounterexample(String text) {

    private static final Field<UpdateCounterexample, String> TEXT =
            Field.optional("text", FieldTypes.STRING, UpdateCounterexample::text);

    public static final RecordSchema<UpdateCounterexample> SCHEMA = RecordSchema.builder(UpdateCounterexample.class)
            .field(TEXT)
            .build(v -> new UpdateCounterexample(v.get(TEXT)));
}
