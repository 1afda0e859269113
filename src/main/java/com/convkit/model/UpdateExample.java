package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record UpdateExample(String text) {

    private static final Field<UpdateExample, String> TEXT =
            Field.optional("text", FieldTypes.STRING, UpdateExample::text);

    public static final RecordSchema<UpdateExample> SCHEMA = RecordSchema.builder(UpdateExample.class)
            .field(TEXT)
            .build(v -> new UpdateExample(v.get(TEXT)));
}
