package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

public record LogPagination(
        String nextUrl,
        Long matched,
        String nextCursor
) {

    private static final Field<LogPagination, String> NEXT_URL =
            Field.optional("next_url", FieldTypes.STRING, LogPagination::nextUrl);
    private static final Field<LogPagination, Long> MATCHED =
            Field.optional("matched", FieldTypes.LONG, LogPagination::matched);
    private static final Field<LogPagination, String> NEXT_CURSOR =
            Field.optional("next_cursor", FieldTypes.STRING, LogPagination::nextCursor);

    public static final RecordSchema<LogPagination> SCHEMA = RecordSchema.builder(LogPagination.class)
            .field(NEXT_URL)
            .field(MATCHED)
            .field(NEXT_CURSOR)
            .build(v -> new LogPagination(v.get(NEXT_URL), v.get(MATCHED), v.get(NEXT_CURSOR)));
}
