package com.convkit.codec;

import com.convkit.model.NodeType;
import com.convkit.shared.error.DecodeException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldTypesTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void numbersAreNotCoercedFromStrings() {
        assertThrows(DecodeException.class, () -> FieldTypes.LONG.decode(TextNode.valueOf("12"), "$.n"));
        assertThrows(DecodeException.class, () -> FieldTypes.STRING.decode(NODES.numberNode(12), "$.s"));
        assertThrows(DecodeException.class, () -> FieldTypes.BOOLEAN.decode(TextNode.valueOf("true"), "$.b"));
    }

    @Test
    void intRejectsValuesOutsideItsRange() {
        var e = assertThrows(DecodeException.class,
                () -> FieldTypes.INT.decode(NODES.numberNode(5_000_000_000L), "$.i"));
        assertEquals(DecodeException.Kind.WRONG_TYPE, e.kind());
        assertEquals(Long.MAX_VALUE, FieldTypes.LONG.decode(NODES.numberNode(Long.MAX_VALUE), "$.l"));
    }

    @Test
    void doubleKeepsFullPrecision() {
        double confidence = 0.9412345678901234;
        var decoded = FieldTypes.DOUBLE.decode(FieldTypes.DOUBLE.encode(confidence), "$.c");
        assertEquals(confidence, decoded);
        assertEquals(1.0, FieldTypes.DOUBLE.decode(NODES.numberNode(1), "$.c"));
    }

    @Test
    void nullArrayElementFailsTheArray() {
        var array = NODES.arrayNode().add("a").addNull();
        var e = assertThrows(DecodeException.class,
                () -> FieldTypes.listOf(FieldTypes.STRING).decode(array, "$.xs"));
        assertEquals("$.xs[1]", e.path());
    }

    @Test
    void jsonObjectRequiresAnObject() {
        assertThrows(DecodeException.class, () -> FieldTypes.JSON_OBJECT.decode(NODES.arrayNode(), "$.o"));
        var map = FieldTypes.JSON_OBJECT.decode(NODES.objectNode().put("k", 1), "$.o");
        assertEquals(1, map.get("k").intValue());
    }

    @Test
    void enumKeepsUnrecognizedValues() {
        var type = FieldTypes.enumOf(NodeType.class);
        var known = type.decode(TextNode.valueOf("frame"), "$.type");
        assertTrue(known.is(NodeType.FRAME));

        var unknown = type.decode(TextNode.valueOf("folder"), "$.type");
        assertFalse(unknown.isRecognized());
        assertEquals("folder", unknown.wire());
        assertEquals("folder", type.encode(unknown).textValue());
    }
}
