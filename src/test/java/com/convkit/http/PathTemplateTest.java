package com.convkit.http;

import com.convkit.shared.error.EncodingException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathTemplateTest {

    private static final PathTemplate EXAMPLE =
            PathTemplate.of("/v1/workspaces/{workspace_id}/intents/{intent}/examples/{text}");

    @Test
    void listsParameterNames() {
        assertEquals(List.of("workspace_id", "intent", "text"), EXAMPLE.parameterNames());
    }

    @Test
    void slashesAndSpacesStayInsideOneSegment() {
        var path = EXAMPLE.expand("ws-1", "order/pizza", "one large please");
        assertEquals("/v1/workspaces/ws-1/intents/order%2Fpizza/examples/one%20large%20please", path);
    }

    @Test
    void encodedSegmentDecodesToOriginal() {
        for (var value : List.of("a/b c", "café au lait", "50%+?#&=", "🍕 slice", "x:y@z")) {
            var segment = UriEncoding.encodePathSegment(value);
            assertFalse(segment.contains("/"));
            var decoded = URI.create("http://host/" + segment).getPath().substring(1);
            assertEquals(value, decoded);
        }
    }

    @Test
    void unpairedSurrogateCannotBeEncoded() {
        assertThrows(EncodingException.class, () -> EXAMPLE.expand("ws", "\uD800", "t"));
    }

    @Test
    void emptyOrMissingValueIsRejected() {
        assertThrows(EncodingException.class, () -> EXAMPLE.expand("ws", "", "t"));
        assertThrows(EncodingException.class, () -> EXAMPLE.expand("ws", null, "t"));
    }

    @Test
    void dotSegmentsAreRejected() {
        var counterexample = PathTemplate.of("/v1/workspaces/{workspace_id}/counterexamples/{text}");
        assertThrows(EncodingException.class, () -> counterexample.expand("ws-1", ".."));
        assertThrows(EncodingException.class, () -> counterexample.expand(".", "taxi"));
        assertEquals("/v1/workspaces/ws-1/counterexamples/...", counterexample.expand("ws-1", "..."));
        assertEquals("/v1/workspaces/ws-1/counterexamples/..%2F", counterexample.expand("ws-1", "../"));
    }

    @Test
    void wrongArgumentCountIsAProgrammingError() {
        assertThrows(IllegalArgumentException.class, () -> EXAMPLE.expand("ws"));
        assertThrows(IllegalArgumentException.class, () -> PathTemplate.of("v1/workspaces"));
    }

    @Test
    void queryComponentsEscapeReservedCharacters() {
        assertEquals("a%2Bb%3Dc%26d%20e", UriEncoding.encodeQueryComponent("a+b=c&d e"));
        assertEquals("-._~", UriEncoding.encodeQueryComponent("-._~"));
    }
}
