package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record Intent(
        String intent,
        String created,
        String updated,
        String description
) {

    private static final Field<Intent, String> INTENT =
            Field.required("intent", FieldTypes.STRING, Intent::intent);
    private static final Field<Intent, String> CREATED =
            Field.optional("created", FieldTypes.STRING, Intent::created);
    private static final Field<Intent, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, Intent::updated);
    private static final Field<Intent, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, Intent::description);

    public static final RecordSchema<Intent> SCHEMA = RecordSchema.builder(Intent.class)
            .field(INTENT)
            .field(CREATED)
            .field(UPDATED)
            .field(DESCRIPTION)
            .build(v -> new Intent(v.get(INTENT), v.get(CREATED), v.get(UPDATED), v.get(DESCRIPTION)));
}
