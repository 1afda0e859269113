package com.convkit.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".convkit", "config.yaml"
    );

    public static ClientConfig load() {
        return load(DEFAULT_PATH);
    }

    public static ClientConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static ClientConfig load(Path path, Env env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var service = (Map<String, Object>) raw.getOrDefault("service", Map.of());
        var auth = (Map<String, Object>) raw.getOrDefault("auth", Map.of());
        var http = (Map<String, Object>) raw.getOrDefault("http", Map.of());
        var headers = (Map<String, Object>) raw.getOrDefault("headers", Map.of());
        var defaults = ClientConfig.defaults();

        var defaultHeaders = new LinkedHashMap<String, String>();
        headers.forEach((k, v) -> {
            if (v != null) defaultHeaders.put(k, stringOrNull(v));
        });

        return new ClientConfig(
            envOrDefault(env, "CONVKIT_SERVICE_URL",
                stringOrNull(service.getOrDefault("url", defaults.serviceUrl()))),
            envOrDefault(env, "CONVKIT_VERSION",
                stringOrNull(service.getOrDefault("version", defaults.version()))),
            envOrDefault(env, "CONVKIT_USERNAME", stringOrNull(auth.get("username"))),
            envOrDefault(env, "CONVKIT_PASSWORD", stringOrNull(auth.get("password"))),
            envOrDefault(env, "CONVKIT_API_KEY", stringOrNull(auth.get("api-key"))),
            defaultHeaders,
            Integer.parseInt(String.valueOf(http.getOrDefault("connect-timeout", defaults.connectTimeoutSeconds()))),
            Integer.parseInt(String.valueOf(http.getOrDefault("request-timeout", defaults.requestTimeoutSeconds())))
        );
    }

    private static String stringOrNull(Object value) {
        if (value == null) return null;
        // YAML reads a bare 2017-05-26 as a timestamp
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate().toString();
        }
        return String.valueOf(value);
    }

    private static String envOrDefault(Env env, String name, String fallback) {
        var val = env.get(name);
        return val != null ? val : fallback;
    }

    @FunctionalInterface
    interface Env {
        String get(String name);
    }
}
