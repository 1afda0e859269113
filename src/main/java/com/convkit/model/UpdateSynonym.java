package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record UpdateSynonym(String synonym) {

    private static final Field<UpdateSynonym, String> SYNONYM =
            Field.optional("synonym", FieldTypes.STRING, UpdateSynonym::synonym);

    public static final RecordSchema<UpdateSynonym> SCHEMA = RecordSchema.builder(UpdateSynonym.class)
            .field(SYNONYM)
            .build(v -> new UpdateSynonym(v.get(SYNONYM)));
}
