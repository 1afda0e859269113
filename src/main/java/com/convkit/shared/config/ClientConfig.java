package com.convkit.shared.config;

import com.convkit.auth.Credentials;

import java.util.Map;

public record ClientConfig(
    String serviceUrl,
    String version,
    String username,
    String password,
    String apiKey,
    Map<String, String> defaultHeaders,
    int connectTimeoutSeconds,
    int requestTimeoutSeconds
) {
    public static final String DEFAULT_SERVICE_URL = "https://gateway.watsonplatform.net/conversation/api";
    public static final String DEFAULT_VERSION = "2017-05-26";

    public ClientConfig {
        defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    public static ClientConfig defaults() {
        return new ClientConfig(DEFAULT_SERVICE_URL, DEFAULT_VERSION, null, null, null, Map.of(), 10, 30);
    }

    /** Bearer when an API key is set, basic when a username is set, none otherwise. */
    public Credentials credentials() {
        if (apiKey != null && !apiKey.isBlank()) return Credentials.bearer(apiKey);
        if (username != null && !username.isBlank()) return Credentials.basic(username, password == null ? "" : password);
        return Credentials.none();
    }

    @Override
    public String toString() {
        return "ClientConfig[serviceUrl=" + serviceUrl + ", version=" + version
            + ", username=" + username + ", password=" + (password == null ? null : "****")
            + ", apiKey=" + (apiKey == null ? null : "****")
            + ", defaultHeaders=" + defaultHeaders.keySet()
            + ", connectTimeoutSeconds=" + connectTimeoutSeconds
            + ", requestTimeoutSeconds=" + requestTimeoutSeconds + "]";
    }
}
