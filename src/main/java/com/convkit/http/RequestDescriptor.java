package com.convkit.http;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A fully built request: encoded path, query items, headers and serialized body.
 * Credentials are not part of it; the transport attaches them.
 */
public record RequestDescriptor(
        HttpMethod method,
        String baseUrl,
        String path,
        List<QueryItem> query,
        Map<String, String> headers,
        byte[] body
) {

    public RequestDescriptor {
        query = List.copyOf(query);
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public URI uri() {
        if (query.isEmpty()) return URI.create(baseUrl + path);
        var qs = query.stream().map(QueryItem::encoded).collect(Collectors.joining("&"));
        return URI.create(baseUrl + path + "?" + qs);
    }

    public Optional<String> queryValue(String name) {
        return query.stream().filter(i -> i.name().equals(name)).map(QueryItem::value).findFirst();
    }

    public boolean hasBody() {
        return body != null;
    }

    public String bodyAsString() {
        return body == null ? null : new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
