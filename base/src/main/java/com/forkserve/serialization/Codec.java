package com.forkserve.serialization;

import com.forkserve.base.Result;

import java.util.Arrays;

/**
 * Two-way mapping between values and wire bytes.
 *
 * Failures come back as a {@link Result}; the request path falls back to an
 * empty body, the response path to a 500.
 */
public interface Codec<A> {

    Result<byte[]> encode(A value);

    Result<A> decode(byte[] bytes);

    /**
     * Decode {@code length} bytes starting at {@code offset}. Implementations
     * that can read a slice in place should override this.
     */
    default Result<A> decode(byte[] bytes, int offset, int length) {
        return decode(Arrays.copyOfRange(bytes, offset, offset + length));
    }

    String contentType();
}
