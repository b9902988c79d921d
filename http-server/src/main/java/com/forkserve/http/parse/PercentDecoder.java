package com.forkserve.http.parse;

import com.forkserve.base.Result;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * URI component decoding: {@code %XX} escapes are UTF-8 bytes, every other
 * character is taken literally ({@code +} included).
 */
public final class PercentDecoder {

    private PercentDecoder() {}

    /**
     * Decode one component. Fails on a truncated or non-hex escape and on
     * escapes that do not form valid UTF-8.
     */
    public static Result<String> decode(String s) {
        if (s.indexOf('%') < 0) {
            return Result.success(s);
        }
        return Result.of(() -> decodeEscapes(s));
    }

    private static String decodeEscapes(String s) throws CharacterCodingException {
        StringBuilder out = new StringBuilder(s.length());
        ByteArrayOutputStream run = new ByteArrayOutputStream();
        int i = 0;
        int len = s.length();
        while (i < len) {
            char c = s.charAt(i);
            if (c != '%') {
                out.append(c);
                i++;
                continue;
            }
            run.reset();
            while (i < len && s.charAt(i) == '%') {
                if (i + 2 >= len) {
                    throw new IllegalArgumentException("Truncated escape at " + i);
                }
                int hi = Character.digit(s.charAt(i + 1), 16);
                int lo = Character.digit(s.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw new IllegalArgumentException("Invalid escape at " + i);
                }
                run.write((hi << 4) | lo);
                i += 3;
            }
            out.append(utf8().decode(ByteBuffer.wrap(run.toByteArray())));
        }
        return out.toString();
    }

    private static CharsetDecoder utf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
