package com.convkit.codec;

import com.convkit.model.InputData;
import com.convkit.shared.error.DecodeException;
import com.convkit.shared.error.SerializationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

    @Test
    void malformedJsonIsADecodeError() {
        var e = assertThrows(DecodeException.class,
                () -> JsonCodec.decode("{\"text\":".getBytes(StandardCharsets.UTF_8), InputData.SCHEMA));
        assertEquals(DecodeException.Kind.MALFORMED_JSON, e.kind());
        assertEquals("$", e.path());
    }

    @Test
    void encodeFailureBecomesSerializationError() {
        Map<String, JsonNode> bag = Map.of("text", TextNode.valueOf("dup"));
        var input = new InputData("hi", bag);
        var e = assertThrows(SerializationException.class, () -> JsonCodec.toBytes(input, InputData.SCHEMA));
        assertTrue(e.getMessage().contains("InputData"));
    }

    @Test
    void textAndExtraPropertyEncodeSideBySide() {
        var input = new InputData("hi", Map.of("foo", TextNode.valueOf("bar")));
        assertEquals("{\"text\":\"hi\",\"foo\":\"bar\"}", JsonCodec.toJson(input, InputData.SCHEMA));
    }
}
