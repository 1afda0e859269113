package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record MessageResponse(
        MessageInput input,
        List<RuntimeIntent> intents,
        List<RuntimeEntity> entities,
        Boolean alternateIntents,
        Context context,
        OutputData output,
        Map<String, JsonNode> additionalProperties
) {

    private static final Field<MessageResponse, MessageInput> INPUT =
            Field.optional("input", MessageInput.SCHEMA, MessageResponse::input);
    private static final Field<MessageResponse, List<RuntimeIntent>> INTENTS =
            Field.required("intents", FieldTypes.listOf(RuntimeIntent.SCHEMA), MessageResponse::intents);
    private static final Field<MessageResponse, List<RuntimeEntity>> ENTITIES =
            Field.required("entities", FieldTypes.listOf(RuntimeEntity.SCHEMA), MessageResponse::entities);
    private static final Field<MessageResponse, Boolean> ALTERNATE_INTENTS =
            Field.optional("alternate_intents", FieldTypes.BOOLEAN, MessageResponse::alternateIntents);
    private static final Field<MessageResponse, Context> CONTEXT =
            Field.required("context", Context.SCHEMA, MessageResponse::context);
    private static final Field<MessageResponse, OutputData> OUTPUT =
            Field.required("output", OutputData.SCHEMA, MessageResponse::output);

    public static final RecordSchema<MessageResponse> SCHEMA = RecordSchema.builder(MessageResponse.class)
            .field(INPUT)
            .field(INTENTS)
            .field(ENTITIES)
            .field(ALTERNATE_INTENTS)
            .field(CONTEXT)
            .field(OUTPUT)
            .extensions(MessageResponse::additionalProperties)
            .build(v -> new MessageResponse(
                    v.get(INPUT),
                    v.get(INTENTS),
                    v.get(ENTITIES),
                    v.get(ALTERNATE_INTENTS),
                    v.get(CONTEXT),
                    v.get(OUTPUT),
                    v.extensions()));

    public MessageResponse {
        intents = ModelSupport.list(intents);
        entities = ModelSupport.list(entities);
        additionalProperties = ModelSupport.bag(additionalProperties);
    }

    /** The dialog output lines joined with newlines. */
    public String text() {
        return output == null || output.text() == null ? "" : String.join("\n", output.text());
    }

    /** The intent with the highest confidence, if any was recognized. Intents without a confidence are skipped. */
    public Optional<RuntimeIntent> topIntent() {
        if (intents == null) return Optional.empty();
        return intents.stream()
                .filter(i -> i.confidence() != null)
                .max(Comparator.comparingDouble(RuntimeIntent::confidence));
    }
}
