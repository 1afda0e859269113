package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record Synonym(
        String synonym,
        String created,
        String updated
) {

    private static final Field<Synonym, String> SYNONYM =
            Field.required("synonym", FieldTypes.STRING, Synonym::synonym);
    private static final Field<Synonym, String> CREATED =
            Field.optional("created", FieldTypes.STRING, Synonym::created);
    private static final Field<Synonym, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, Synonym::updated);

    public static final RecordSchema<Synonym> SCHEMA = RecordSchema.builder(Synonym.class)
            .field(SYNONYM)
            .field(CREATED)
            .field(UPDATED)
            .build(v -> new Synonym(v.get(SYNONYM), v.get(CREATED), v.get(UPDATED)));
}
