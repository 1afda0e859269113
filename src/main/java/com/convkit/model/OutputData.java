package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record OutputData(
        List<LogMessage> logMessages,
        List<String> text,
        List<String> nodesVisited,
        Map<String, JsonNode> additionalProperties
) {

    private static final Field<OutputData, List<LogMessage>> LOG_MESSAGES =
            Field.required("log_messages", FieldTypes.listOf(LogMessage.SCHEMA), OutputData::logMessages);
    private static final Field<OutputData, List<String>> TEXT =
            Field.required("text", FieldTypes.listOf(FieldTypes.STRING), OutputData::text);
    private static final Field<OutputData, List<String>> NODES_VISITED =
            Field.optional("nodes_visited", FieldTypes.listOf(FieldTypes.STRING), OutputData::nodesVisited);

    public static final RecordSchema<OutputData> SCHEMA = RecordSchema.builder(OutputData.class)
            .field(LOG_MESSAGES)
            .field(TEXT)
            .field(NODES_VISITED)
            .extensions(OutputData::additionalProperties)
            .build(v -> new OutputData(
                    v.get(LOG_MESSAGES),
                    v.get(TEXT),
                    v.get(NODES_VISITED),
                    v.extensions()));

    public OutputData {
        logMessages = ModelSupport.list(logMessages);
        text = ModelSupport.list(text);
        nodesVisited = ModelSupport.list(nodesVisited);
        additionalProperties = ModelSupport.bag(additionalProperties);
    }

    public OutputData(List<String> text) {
        this(List.of(), text, null, Map.of());
    }
}
