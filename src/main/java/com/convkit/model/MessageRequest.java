package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record MessageRequest(
        InputData input,
        Boolean alternateIntents,
        Context context,
        List<RuntimeEntity> entities,
        List<RuntimeIntent> intents,
        OutputData output
) {

    private static final Field<MessageRequest, InputData> INPUT =
            Field.optional("input", InputData.SCHEMA, MessageRequest::input);
    private static final Field<MessageRequest, Boolean> ALTERNATE_INTENTS =
            Field.optional("alternate_intents", FieldTypes.BOOLEAN, MessageRequest::alternateIntents);
    private static final Field<MessageRequest, Context> CONTEXT =
            Field.optional("context", Context.SCHEMA, MessageRequest::context);
    private static final Field<MessageRequest, List<RuntimeEntity>> ENTITIES =
            Field.optional("entities", FieldTypes.listOf(RuntimeEntity.SCHEMA), MessageRequest::entities);
    private static final Field<MessageRequest, List<RuntimeIntent>> INTENTS =
            Field.optional("intents", FieldTypes.listOf(RuntimeIntent.SCHEMA), MessageRequest::intents);
    private static final Field<MessageRequest, OutputData> OUTPUT =
            Field.optional("output", OutputData.SCHEMA, MessageRequest::output);

    public static final RecordSchema<MessageRequest> SCHEMA = RecordSchema.builder(MessageRequest.class)
            .field(INPUT)
            .field(ALTERNATE_INTENTS)
            .field(CONTEXT)
            .field(ENTITIES)
            .field(INTENTS)
            .field(OUTPUT)
            .build(v -> new MessageRequest(
                    v.get(INPUT),
                    v.get(ALTERNATE_INTENTS),
                    v.get(CONTEXT),
                    v.get(ENTITIES),
                    v.get(INTENTS),
                    v.get(OUTPUT)));

    public MessageRequest {
        entities = ModelSupport.list(entities);
        intents = ModelSupport.list(intents);
    }

    /** A request carrying only user text and, when continuing a conversation, its context. */
    public static MessageRequest of(String text, Context context) {
        return new MessageRequest(new InputData(text), null, context, null, null, null);
    }

    public static MessageRequest of(String text) {
        return of(text, null);
    }
}
