package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record CreateIntent(
        String intent,
        String description,
        List<CreateExample> examples
) {

    private static final Field<CreateIntent, String> INTENT =
            Field.required("intent", FieldTypes.STRING, CreateIntent::intent);
    private static final Field<CreateIntent, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, CreateIntent::description);
    private static final Field<CreateIntent, List<CreateExample>> EXAMPLES =
            Field.optional("examples", FieldTypes.listOf(CreateExample.SCHEMA), CreateIntent::examples);

    public static final RecordSchema<CreateIntent> SCHEMA = RecordSchema.builder(CreateIntent.class)
            .field(INTENT)
            .field(DESCRIPTION)
            .field(EXAMPLES)
            .build(v -> new CreateIntent(v.get(INTENT), v.get(DESCRIPTION), v.get(EXAMPLES)));

    public CreateIntent {
        examples = ModelSupport.list(examples);
    }

    public CreateIntent(String intent) {
        this(intent, null, null);
    }
}
