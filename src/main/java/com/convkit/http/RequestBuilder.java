package com.convkit.http;

import com.convkit.codec.JsonCodec;
import com.convkit.codec.RecordSchema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds a {@link RequestDescriptor} for one operation. Nothing here performs I/O: path
 * encoding fails with {@code EncodingException} and body encoding with
 * {@code SerializationException}, both from {@link #build()}.
 */
public final class RequestBuilder {

    private static final String JSON = "application/json";

    private final HttpMethod method;
    private final String baseUrl;
    private final PathTemplate path;
    private final String[] pathParams;
    private final QueryParams query = new QueryParams();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private Supplier<byte[]> body;

    private RequestBuilder(HttpMethod method, String baseUrl, String version, PathTemplate path, String[] pathParams) {
        this.method = Objects.requireNonNull(method, "method");
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.path = path;
        this.pathParams = pathParams;
        query.add("version", Objects.requireNonNull(version, "version"));
    }

    public static RequestBuilder request(HttpMethod method, String baseUrl, String version,
                                         PathTemplate path, String... pathParams) {
        return new RequestBuilder(method, baseUrl, version, path, pathParams);
    }

    public RequestBuilder query(String name, Object value) {
        query.addIfPresent(name, value);
        return this;
    }

    public RequestBuilder header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public RequestBuilder headers(Map<String, String> values) {
        headers.putAll(values);
        return this;
    }

    public <T> RequestBuilder body(T record, RecordSchema<T> schema) {
        Objects.requireNonNull(record, "body");
        this.body = () -> JsonCodec.toBytes(record, schema);
        return this;
    }

    public RequestDescriptor build() {
        var encodedPath = path.expand(pathParams);
        var bytes = body != null ? body.get() : null;

        var allHeaders = new LinkedHashMap<>(headers);
        allHeaders.put("Accept", JSON);
        if (bytes != null) allHeaders.put("Content-Type", JSON);

        return new RequestDescriptor(method, baseUrl, encodedPath, query.items(), allHeaders, bytes);
    }
}
