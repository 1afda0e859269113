package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record CreateExample(String text) {

    private static final Field<CreateExample, String> TEXT =
            Field.required("text", FieldTypes.STRING, CreateExample::text);

    public static final RecordSchema<CreateExample> SCHEMA = RecordSchema.builder(CreateExample.class)
            .field(TEXT)
            .build(v -> new CreateExample(v.get(TEXT)));
}
