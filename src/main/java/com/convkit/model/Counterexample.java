package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

/** A user input marked as irrelevant to every intent of the workspace. */
public record Counterexample(
        String text,
        String created,
        String updated
) {

    private static final Field<Counterexample, String> TEXT =
            Field.required("text", FieldTypes.STRING, Counterexample::text);
    private static final Field<Counterexample, String> CREATED =
            Field.required("created", FieldTypes.STRING, Counterexample::created);
    private static final Field<Counterexample, String> UPDATED =
            Field.required("updated", FieldTypes.STRING, Counterexample::updated);

    public static final RecordSchema<Counterexample> SCHEMA = RecordSchema.builder(Counterexample.class)
            .field(TEXT)
            .field(CREATED)
            .field(UPDATED)
            .build(v -> new Counterexample(v.get(TEXT), v.get(CREATED), v.get(UPDATED)));
}
