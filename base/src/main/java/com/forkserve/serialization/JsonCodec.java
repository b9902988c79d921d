package com.forkserve.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.forkserve.base.Result;

/**
 * Jackson-backed codecs sharing one {@link ObjectMapper}.
 *
 * <pre>
 *   Codec&lt;Object&gt; json = JsonCodec.forAny();
 *   byte[] out = json.encode(Map.of("status", "healthy")).getOrThrow();
 * </pre>
 */
public final class JsonCodec {

    public static final String CONTENT_TYPE = "application/json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private static final Codec<Object> ANY = new Jackson<>(Object.class);

    private JsonCodec() {}

    public static <A> Codec<A> forClass(Class<A> type) {
        return new Jackson<>(type);
    }

    /**
     * Untyped codec: objects decode to maps, arrays to lists, scalars to
     * boxed values. A bare JSON {@code null} is a decode failure.
     */
    public static Codec<Object> forAny() {
        return ANY;
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    private record Jackson<A>(Class<A> type) implements Codec<A> {

        @Override
        public Result<byte[]> encode(A value) {
            return Result.of(() -> MAPPER.writeValueAsBytes(value));
        }

        @Override
        public Result<A> decode(byte[] bytes) {
            return decode(bytes, 0, bytes.length);
        }

        @Override
        public Result<A> decode(byte[] bytes, int offset, int length) {
            return Result.of(() -> MAPPER.readValue(bytes, offset, length, type));
        }

        @Override
        public String contentType() {
            return CONTENT_TYPE;
        }
    }
}
