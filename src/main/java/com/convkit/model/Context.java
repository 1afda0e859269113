package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Conversation state returned by every message exchange. Pass it into the next
 * {@link MessageRequest} to continue the same conversation; application variables set by the
 * dialog live in the extension bag.
 */
public record Context(
        String conversationId,
        SystemResponse system,
        Map<String, JsonNode> additionalProperties
) {

    private static final Field<Context, String> CONVERSATION_ID =
            Field.required("conversation_id", FieldTypes.STRING, Context::conversationId);
    private static final Field<Context, SystemResponse> SYSTEM =
            Field.required("system", SystemResponse.SCHEMA, Context::system);

    public static final RecordSchema<Context> SCHEMA = RecordSchema.builder(Context.class)
            .field(CONVERSATION_ID)
            .field(SYSTEM)
            .extensions(Context::additionalProperties)
            .build(v -> new Context(v.get(CONVERSATION_ID), v.get(SYSTEM), v.extensions()));

    public Context {
        additionalProperties = ModelSupport.bag(additionalProperties);
    }

    public Context(String conversationId, SystemResponse system) {
        this(conversationId, system, Map.of());
    }
}
