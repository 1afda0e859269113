package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record UpdateIntent(
        String intent,
        String description,
        List<CreateExample> examples
) {

    private static final Field<UpdateIntent, String> INTENT =
            Field.optional("intent", FieldTypes.STRING, UpdateIntent::intent);
    private static final Field<UpdateIntent, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, UpdateIntent::description);
    private static final Field<UpdateIntent, List<CreateExample>> EXAMPLES =
            Field.optional("examples", FieldTypes.listOf(CreateExample.SCHEMA), UpdateIntent::examples);

    public static final RecordSchema<UpdateIntent> SCHEMA = RecordSchema.builder(UpdateIntent.class)
            .field(INTENT)
            .field(DESCRIPTION)
            .field(EXAMPLES)
            .build(v -> new UpdateIntent(v.get(INTENT), v.get(DESCRIPTION), v.get(EXAMPLES)));

    public UpdateIntent {
        examples = ModelSupport.list(examples);
    }
}
