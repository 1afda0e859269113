package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record IntentExport(
        String intent,
        String created,
        String updated,
        String description,
        List<Example> examples
) {

    private static final Field<IntentExport, String> INTENT =
            Field.required("intent", FieldTypes.STRING, IntentExport::intent);
    private static final Field<IntentExport, String> CREATED =
            Field.optional("created", FieldTypes.STRING, IntentExport::created);
    private static final Field<IntentExport, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, IntentExport::updated);
    private static final Field<IntentExport, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, IntentExport::description);
    private static final Field<IntentExport, List<Example>> EXAMPLES =
            Field.optional("examples", FieldTypes.listOf(Example.SCHEMA), IntentExport::examples);

    public static final RecordSchema<IntentExport> SCHEMA = RecordSchema.builder(IntentExport.class)
            .field(INTENT)
            .field(CREATED)
            .field(UPDATED)
            .field(DESCRIPTION)
            .field(EXAMPLES)
            .build(v -> new IntentExport(
                    v.get(INTENT),
                    v.get(CREATED),
                    v.get(UPDATED),
                    v.get(DESCRIPTION),
                    v.get(EXAMPLES)));

    public IntentExport {
        examples = ModelSupport.list(examples);
    }
}
