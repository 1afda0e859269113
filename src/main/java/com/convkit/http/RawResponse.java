package com.convkit.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public record RawResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public RawResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public RawResponse(int statusCode, String body) {
        this(statusCode, Map.of(), body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** Whether the body holds anything but whitespace. */
    public boolean hasBody() {
        for (byte b : body) {
            if (b != ' ' && b != '\n' && b != '\r' && b != '\t') return true;
        }
        return false;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
