package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record Example(
        String text,
        String created,
        String updated
) {

    private static final Field<Example, String> TEXT =
            Field.required("text", FieldTypes.STRING, Example::text);
    private static final Field<Example, String> CREATED =
            Field.optional("created", FieldTypes.STRING, Example::created);
    private static final Field<Example, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, Example::updated);

    public static final RecordSchema<Example> SCHEMA = RecordSchema.builder(Example.class)
            .field(TEXT)
            .field(CREATED)
            .field(UPDATED)
            .build(v -> new Example(v.get(TEXT), v.get(CREATED), v.get(UPDATED)));
}
