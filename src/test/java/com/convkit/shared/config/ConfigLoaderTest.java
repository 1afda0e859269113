package com.convkit.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"), name -> null);
        assertEquals(ClientConfig.DEFAULT_SERVICE_URL, cfg.serviceUrl());
        assertEquals("2017-05-26", cfg.version());
        assertEquals(10, cfg.connectTimeoutSeconds());
        assertEquals(30, cfg.requestTimeoutSeconds());
        assertTrue(cfg.defaultHeaders().isEmpty());
        assertTrue(cfg.credentials().authorizationHeader().isEmpty());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            service:
              url: https://gateway-fra.example.com/conversation/api
              version: 2017-04-21
            auth:
              username: apikey
              password: s3cret
            http:
              connect-timeout: 3
              request-timeout: 15
            headers:
              X-Watson-Learning-Opt-Out: true
            """;
        var cfg = writeAndLoad(yaml, Map.of());
        assertEquals("https://gateway-fra.example.com/conversation/api", cfg.serviceUrl());
        assertEquals("2017-04-21", cfg.version());
        assertEquals("apikey", cfg.username());
        assertEquals(3, cfg.connectTimeoutSeconds());
        assertEquals(15, cfg.requestTimeoutSeconds());
        assertEquals("true", cfg.defaultHeaders().get("X-Watson-Learning-Opt-Out"));
        assertTrue(cfg.credentials().authorizationHeader().orElseThrow().startsWith("Basic "));
    }

    @Test
    void environmentOverridesFile() throws IOException {
        var yaml = """
            auth:
              username: apikey
              password: s3cret
            """;
        var cfg = writeAndLoad(yaml, Map.of("CONVKIT_API_KEY", "tok", "CONVKIT_VERSION", "2018-02-16"));
        assertEquals("2018-02-16", cfg.version());
        assertEquals("Bearer tok", cfg.credentials().authorizationHeader().orElseThrow());
    }

    @Test
    void emptyFileFallsBackToDefaults() throws IOException {
        var cfg = writeAndLoad("", Map.of());
        assertEquals(ClientConfig.DEFAULT_VERSION, cfg.version());
    }

    @Test
    void toStringHidesSecrets() {
        var cfg = new ClientConfig("u", "v", "user", "pw", "key", Map.of(), 1, 1);
        assertFalse(cfg.toString().contains("pw"));
        assertFalse(cfg.toString().contains("key,"));
    }

    private ClientConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env::get);
    }
}
