package com.convkit.shared.error;

import com.fasterxml.jackson.databind.node.BinaryNode;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DecodeExceptionTest {

    @Test
    void wrongTypeNamesTheNodeType() {
        var e = DecodeException.wrongType("$.text", "string", BinaryNode.valueOf(new byte[] {1}));
        assertEquals("$.text: expected string but found binary", e.getMessage());
        assertEquals("$.text", e.path());
        assertEquals(DecodeException.Kind.WRONG_TYPE, e.kind());
    }

    @Test
    void nodeTypeNameIgnoresDefaultLocale() {
        var previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            var e = DecodeException.wrongType("$.n", "number", BinaryNode.valueOf(new byte[] {1}));
            assertTrue(e.getMessage().endsWith("found binary"), e.getMessage());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void missingValueIsDescribedAsNothing() {
        assertEquals("$.a: expected object but found nothing",
                DecodeException.wrongType("$.a", "object", null).getMessage());
    }
}
