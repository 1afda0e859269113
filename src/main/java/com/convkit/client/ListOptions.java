package com.convkit.client;

import com.convkit.http.RequestBuilder;

/**
 * Paging options shared by every list operation. A {@code null} component is omitted from the
 * query string.
 */
public record ListOptions(Integer pageLimit, Boolean includeCount, String sort, String cursor) {

    private static final ListOptions NONE = new ListOptions(null, null, null, null);

    public static ListOptions none() {
        return NONE;
    }

    public ListOptions withPageLimit(int pageLimit) {
        return new ListOptions(pageLimit, includeCount, sort, cursor);
    }

    public ListOptions withIncludeCount(boolean includeCount) {
        return new ListOptions(pageLimit, includeCount, sort, cursor);
    }

    public ListOptions withSort(String sort) {
        return new ListOptions(pageLimit, includeCount, sort, cursor);
    }

    public ListOptions withCursor(String cursor) {
        return new ListOptions(pageLimit, includeCount, sort, cursor);
    }

    RequestBuilder applyTo(RequestBuilder request) {
        return request
                .query("page_limit", pageLimit)
                .query("include_count", includeCount)
                .query("sort", sort)
                .query("cursor", cursor);
    }
}
