package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record CreateSynonym(String synonym) {

    private static final Field<CreateSynonym, String> SYNONYM =
            Field.required("synonym", FieldTypes.STRING, CreateSynonym::synonym);

    public static final RecordSchema<CreateSynonym> SCHEMA = RecordSchema.builder(CreateSynonym.class)
            .field(SYNONYM)
            .build(v -> new CreateSynonym(v.get(SYNONYM)));
}
