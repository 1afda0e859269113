package com.convkit.http;

import java.util.ArrayList;
import java.util.List;

/** Ordered query items. Optional parameters are only appended when the caller gave a value. */
public final class QueryParams {

    private final List<QueryItem> items = new ArrayList<>();

    public QueryParams add(String name, String value) {
        items.add(new QueryItem(name, value));
        return this;
    }

    /** Appends {@code String.valueOf(value)}, so booleans become {@code true}/{@code false} and integers decimal. */
    public QueryParams addIfPresent(String name, Object value) {
        if (value != null) items.add(new QueryItem(name, String.valueOf(value)));
        return this;
    }

    public List<QueryItem> items() {
        return List.copyOf(items);
    }
}
