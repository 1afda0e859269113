package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record LogMessage(
        EnumValue<LogLevel> level,
        String msg,
        Map<String, JsonNode> additionalProperties
) {

    private static final Field<LogMessage, EnumValue<LogLevel>> LEVEL =
            Field.required("level", FieldTypes.enumOf(LogLevel.class), LogMessage::level);
    private static final Field<LogMessage, String> MSG =
            Field.required("msg", FieldTypes.STRING, LogMessage::msg);

    public static final RecordSchema<LogMessage> SCHEMA = RecordSchema.builder(LogMessage.class)
            .field(LEVEL)
            .field(MSG)
            .extensions(LogMessage::additionalProperties)
            .build(v -> new LogMessage(v.get(LEVEL), v.get(MSG), v.extensions()));

    public LogMessage {
        additionalProperties = ModelSupport.bag(additionalProperties);
    }
}
