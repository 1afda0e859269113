package com.convkit.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialsTest {

    @Test
    void basicEncodesUserAndPassword() {
        assertEquals("Basic dXNlcjpwYXNz", Credentials.basic("user", "pass").authorizationHeader().orElseThrow());
    }

    @Test
    void bearerPassesTokenThrough() {
        assertEquals("Bearer abc.def", Credentials.bearer("abc.def").authorizationHeader().orElseThrow());
    }

    @Test
    void noneAddsNothing() {
        assertTrue(Credentials.none().authorizationHeader().isEmpty());
    }
}
