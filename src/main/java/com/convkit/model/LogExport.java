package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

/** One logged message exchange. */
public record LogExport(
        MessageRequest request,
        MessageResponse response,
        String logId,
        String requestTimestamp,
        String responseTimestamp,
        String workspaceId,
        String language
) {

    private static final Field<LogExport, MessageRequest> REQUEST =
            Field.required("request", MessageRequest.SCHEMA, LogExport::request);
    private static final Field<LogExport, MessageResponse> RESPONSE =
            Field.required("response", MessageResponse.SCHEMA, LogExport::response);
    private static final Field<LogExport, String> LOG_ID =
            Field.required("log_id", FieldTypes.STRING, LogExport::logId);
    private static final Field<LogExport, String> REQUEST_TIMESTAMP =
            Field.required("request_timestamp", FieldTypes.STRING, LogExport::requestTimestamp);
    private static final Field<LogExport, String> RESPONSE_TIMESTAMP =
            Field.required("response_timestamp", FieldTypes.STRING, LogExport::responseTimestamp);
    private static final Field<LogExport, String> WORKSPACE_ID =
            Field.optional("workspace_id", FieldTypes.STRING, LogExport::workspaceId);
    private static final Field<LogExport, String> LANGUAGE =
            Field.optional("language", FieldTypes.STRING, LogExport::language);

    public static final RecordSchema<LogExport> SCHEMA = RecordSchema.builder(LogExport.class)
            .field(REQUEST)
            .field(RESPONSE)
            .field(LOG_ID)
            .field(REQUEST_TIMESTAMP)
            .field(RESPONSE_TIMESTAMP)
            .field(WORKSPACE_ID)
            .field(LANGUAGE)
            .build(v -> new LogExport(
                    v.get(REQUEST),
                    v.get(RESPONSE),
                    v.get(LOG_ID),
                    v.get(REQUEST_TIMESTAMP),
                    v.get(RESPONSE_TIMESTAMP),
                    v.get(WORKSPACE_ID),
                    v.get(LANGUAGE)));
}
