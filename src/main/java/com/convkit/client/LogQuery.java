package com.convkit.client;

import com.convkit.http.RequestBuilder;

/** Query for the log listing endpoint. {@code filter} uses the service's filter syntax. */
public record LogQuery(String sort, String filter, Integer pageLimit, String cursor) {

    public static LogQuery none() {
        return new LogQuery(null, null, null, null);
    }

    public static LogQuery filter(String filter) {
        return new LogQuery(null, filter, null, null);
    }

    public LogQuery withSort(String sort) {
        return new LogQuery(sort, filter, pageLimit, cursor);
    }

    public LogQuery withPageLimit(int pageLimit) {
        return new LogQuery(sort, filter, pageLimit, cursor);
    }

    public LogQuery withCursor(String cursor) {
        return new LogQuery(sort, filter, pageLimit, cursor);
    }

    RequestBuilder applyTo(RequestBuilder request) {
        return request
                .query("sort", sort)
                .query("filter", filter)
                .query("page_limit", pageLimit)
                .query("cursor", cursor);
    }
}
