package com.convkit.model;

import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Cursor-based paging details of a collection. {@code total} and {@code matched} are only
 * present when the list call asked for {@code include_count}.
 */
public record Pagination(
        String refreshUrl,
        String nextUrl,
        Long total,
        Long matched,
        String refreshCursor,
        String nextCursor
) {

    private static final Field<Pagination, String> REFRESH_URL =
            Field.required("refresh_url", FieldTypes.STRING, Pagination::refreshUrl);
    private static final Field<Pagination, String> NEXT_URL =
            Field.optional("next_url", FieldTypes.STRING, Pagination::nextUrl);
    private static final Field<Pagination, Long> TOTAL =
            Field.optional("total", FieldTypes.LONG, Pagination::total);
    private static final Field<Pagination, Long> MATCHED =
            Field.optional("matched", FieldTypes.LONG, Pagination::matched);
    private static final Field<Pagination, String> REFRESH_CURSOR =
            Field.optional("refresh_cursor", FieldTypes.STRING, Pagination::refreshCursor);
    private static final Field<Pagination, String> NEXT_CURSOR =
            Field.optional("next_cursor", FieldTypes.STRING, Pagination::nextCursor);

    public static final RecordSchema<Pagination> SCHEMA = RecordSchema.builder(Pagination.class)
            .field(REFRESH_URL)
            .field(NEXT_URL)
            .field(TOTAL)
            .field(MATCHED)
            .field(REFRESH_CURSOR)
            .field(NEXT_CURSOR)
            .build(v -> new Pagination(
                    v.get(REFRESH_URL),
                    v.get(NEXT_URL),
                    v.get(TOTAL),
                    v.get(MATCHED),
                    v.get(REFRESH_CURSOR),
                    v.get(NEXT_CURSOR)));

    public boolean hasNextPage() {
        return cursorForNextPage().isPresent();
    }

    /**
     * The opaque cursor for the following page: {@code next_cursor} when the service sends it,
     * otherwise the {@code cursor} query item of {@code next_url}.
     */
    public Optional<String> cursorForNextPage() {
        if (nextCursor != null) return Optional.of(nextCursor);
        if (nextUrl == null) return Optional.empty();
        int q = nextUrl.indexOf('?');
        if (q < 0) return Optional.empty();
        for (var item : nextUrl.substring(q + 1).split("&")) {
            if (item.startsWith("cursor=")) {
                return Optional.of(URLDecoder.decode(item.substring(7), StandardCharsets.UTF_8));
            }
        }
        return Optional.empty();
    }
}
