package com.convkit.codec;

import com.convkit.shared.error.DecodeException;
import com.convkit.shared.error.EncodeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordSchemaTest {

    record Note(String text, Long stars, List<String> tags, Map<String, JsonNode> extras) {

        static final Field<Note, String> TEXT = Field.required("text", FieldTypes.STRING, Note::text);
        static final Field<Note, Long> STARS = Field.optional("stars", FieldTypes.LONG, Note::stars);
        static final Field<Note, List<String>> TAGS =
                Field.optional("tags", FieldTypes.listOf(FieldTypes.STRING), Note::tags);

        static final RecordSchema<Note> OPEN = RecordSchema.builder(Note.class)
                .field(TEXT)
                .field(STARS)
                .field(TAGS)
                .extensions(Note::extras)
                .build(v -> new Note(v.get(TEXT), v.get(STARS), v.get(TAGS), v.extensions()));

        static final RecordSchema<Note> CLOSED = RecordSchema.builder(Note.class)
                .field(TEXT)
                .field(STARS)
                .field(TAGS)
                .build(v -> new Note(v.get(TEXT), v.get(STARS), v.get(TAGS), Map.of()));
    }

    @Test
    void decodesKnownFieldsByWireKey() {
        var note = JsonCodec.decode("{\"text\":\"hi\",\"stars\":3,\"tags\":[\"a\",\"b\"]}", Note.OPEN);
        assertEquals("hi", note.text());
        assertEquals(3L, note.stars());
        assertEquals(List.of("a", "b"), note.tags());
        assertTrue(note.extras().isEmpty());
    }

    @Test
    void unknownKeysGoToTheBag() {
        var note = JsonCodec.decode("{\"text\":\"hi\",\"foo\":\"bar\",\"n\":{\"x\":[1,null]}}", Note.OPEN);
        assertEquals(2, note.extras().size());
        assertEquals("bar", note.extras().get("foo").textValue());
        assertTrue(note.extras().get("n").get("x").get(1).isNull());
        assertFalse(note.extras().containsKey("text"));
    }

    @Test
    void closedSchemaDropsUnknownKeys() {
        var note = JsonCodec.decode("{\"text\":\"hi\",\"foo\":\"bar\"}", Note.CLOSED);
        assertFalse(Note.CLOSED.isOpen());
        assertTrue(note.extras().isEmpty());
    }

    @Test
    void missingRequiredFieldIsReported() {
        var e = assertThrows(DecodeException.class, () -> JsonCodec.decode("{}", Note.OPEN));
        assertEquals(DecodeException.Kind.MISSING_REQUIRED_FIELD, e.kind());
        assertEquals("Note.text", e.path());
    }

    @Test
    void nullRequiredFieldCountsAsMissing() {
        var e = assertThrows(DecodeException.class, () -> JsonCodec.decode("{\"text\":null}", Note.OPEN));
        assertEquals(DecodeException.Kind.MISSING_REQUIRED_FIELD, e.kind());
    }

    @Test
    void nullOptionalFieldIsAbsent() {
        var note = JsonCodec.decode("{\"text\":\"hi\",\"stars\":null}", Note.OPEN);
        assertNull(note.stars());
        assertFalse(note.extras().containsKey("stars"));
        assertFalse(JsonCodec.encode(note, Note.OPEN).has("stars"));
    }

    @Test
    void wrongTypeCarriesPath() {
        var e = assertThrows(DecodeException.class,
                () -> JsonCodec.decode("{\"text\":\"hi\",\"tags\":[\"a\",7]}", Note.OPEN));
        assertEquals(DecodeException.Kind.WRONG_TYPE, e.kind());
        assertEquals("Note.tags[1]", e.path());
    }

    @Test
    void nonObjectIsWrongType() {
        var e = assertThrows(DecodeException.class, () -> JsonCodec.decode("[1,2]", Note.OPEN));
        assertEquals(DecodeException.Kind.WRONG_TYPE, e.kind());
    }

    @Test
    void encodesKnownFieldsThenBag() {
        var note = new Note("hi", null, null, Map.of("foo", TextNode.valueOf("bar")));
        assertEquals("{\"text\":\"hi\",\"foo\":\"bar\"}", JsonCodec.toJson(note, Note.OPEN));
    }

    @Test
    void bagKeyCollidingWithKnownFieldIsRejected() {
        var note = new Note("hi", null, null, Map.of("text", TextNode.valueOf("other")));
        var e = assertThrows(EncodeException.class, () -> Note.OPEN.encode(note));
        assertEquals(EncodeException.Kind.DUPLICATE_KEY, e.kind());
    }

    @Test
    void bagKeyCollidesEvenWhenKnownFieldIsAbsent() {
        var note = new Note("hi", null, null, Map.of("stars", TextNode.valueOf("5")));
        var e = assertThrows(EncodeException.class, () -> Note.OPEN.encode(note));
        assertEquals(EncodeException.Kind.DUPLICATE_KEY, e.kind());
    }

    @Test
    void encodingNullRequiredFieldFails() {
        var e = assertThrows(EncodeException.class, () -> Note.OPEN.encode(new Note(null, 1L, null, Map.of())));
        assertEquals(EncodeException.Kind.MISSING_REQUIRED_FIELD, e.kind());
    }

    @Test
    void roundTripKeepsKnownFieldsAndBag() {
        var json = "{\"text\":\"hi\",\"stars\":9007199254740993,\"tags\":[],\"extra\":{\"deep\":[true,1.5]}}";
        var note = JsonCodec.decode(json, Note.OPEN);
        var again = JsonCodec.decode(JsonCodec.toBytes(note, Note.OPEN), Note.OPEN);
        assertEquals(note, again);
        assertEquals(9007199254740993L, again.stars());
    }

    @Test
    void duplicateWireKeyInSchemaIsRejected() {
        var builder = RecordSchema.builder(Note.class).field(Note.TEXT);
        assertThrows(IllegalArgumentException.class,
                () -> builder.field(Field.optional("text", FieldTypes.STRING, Note::text)));
    }
}
