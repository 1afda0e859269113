package com.convkit.http;

import com.convkit.shared.error.EncodingException;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

/** RFC 3986 percent-encoding of UTF-8 text. */
public final class UriEncoding {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final BitSet UNRESERVED = new BitSet(128);
    private static final BitSet PATH_SEGMENT = new BitSet(128);

    static {
        for (char c = 'a'; c <= 'z'; c++) UNRESERVED.set(c);
        for (char c = 'A'; c <= 'Z'; c++) UNRESERVED.set(c);
        for (char c = '0'; c <= '9'; c++) UNRESERVED.set(c);
        for (char c : "-._~".toCharArray()) UNRESERVED.set(c);

        // pchar = unreserved / sub-delims / ":" / "@"; "/" is never allowed inside a segment
        PATH_SEGMENT.or(UNRESERVED);
        for (char c : "!$&'()*+,;=:@".toCharArray()) PATH_SEGMENT.set(c);
    }

    private UriEncoding() {}

    /** Encodes one path segment; {@code /}, {@code ?}, {@code #} and spaces are always escaped. */
    public static String encodePathSegment(String value) {
        return encode(value, PATH_SEGMENT);
    }

    /** Encodes a query name or value, leaving only unreserved characters as-is. */
    public static String encodeQueryComponent(String value) {
        return encode(value, UNRESERVED);
    }

    private static String encode(String value, BitSet safe) {
        ByteBuffer bytes;
        try {
            bytes = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value));
        } catch (CharacterCodingException e) {
            throw new EncodingException("Value cannot be percent-encoded, it is not valid Unicode text", e);
        }
        var sb = new StringBuilder(bytes.remaining() + 16);
        while (bytes.hasRemaining()) {
            int b = bytes.get() & 0xff;
            if (b < 128 && safe.get(b)) {
                sb.append((char) b);
            } else {
                sb.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0f]);
            }
        }
        return sb.toString();
    }
}
