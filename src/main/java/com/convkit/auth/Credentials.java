package com.convkit.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/** Supplies the {@code Authorization} header value. Issuing credentials is out of scope. */
@FunctionalInterface
public interface Credentials {

    Optional<String> authorizationHeader();

    static Credentials basic(String username, String password) {
        var token = Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        var header = "Basic " + token;
        return () -> Optional.of(header);
    }

    static Credentials bearer(String token) {
        var header = "Bearer " + token;
        return () -> Optional.of(header);
    }

    static Credentials none() {
        return Optional::empty;
    }
}
