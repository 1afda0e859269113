package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.util.List;

public record LogCollection(List<LogExport> logs, LogPagination pagination) {

    private static final Field<LogCollection, List<LogExport>> LOGS =
            Field.required("logs", FieldTypes.listOf(LogExport.SCHEMA), LogCollection::logs);
    private static final Field<LogCollection, LogPagination> PAGINATION =
            Field.required("pagination", LogPagination.SCHEMA, LogCollection::pagination);

    public static final RecordSchema<LogCollection> SCHEMA = RecordSchema.builder(LogCollection.class)
            .field(LOGS)
            .field(PAGINATION)
            .build(v -> new LogCollection(v.get(LOGS), v.get(PAGINATION)));

    public LogCollection {
        logs = ModelSupport.list(logs);
    }
}
