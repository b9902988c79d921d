package com.forkserve.http.parse;

import com.forkserve.http.buffer.BufferPool;

import java.nio.ByteBuffer;
import java.util.OptionalLong;

/**
 * Incremental reader for one request body, framed by Content-Length or
 * chunked transfer coding.
 *
 * Bytes go either into a pooled buffer lease or nowhere (discard mode, used
 * for methods whose body is ignored and for unrouted requests). The reader
 * never consumes bytes past the end of the body, so pipelined requests stay
 * in the inbound buffer.
 */
public final class BodyReader {

    public enum Progress { NEED_MORE, COMPLETE, OVERFLOW }

    enum Framing { NONE, FIXED, CHUNKED }

    private enum ChunkState { SIZE_LINE, DATA, DATA_END, TRAILER, DONE }

    static final int MAX_LINE = 4096;

    private final Framing framing;
    private final BufferPool.Lease lease;
    private long remaining;

    private ChunkState chunkState = ChunkState.SIZE_LINE;
    private final StringBuilder line = new StringBuilder();

    private BodyReader(Framing framing, long length, BufferPool.Lease lease) {
        this.framing = framing;
        this.remaining = length;
        this.lease = lease;
    }

    /**
     * Reader that consumes the body without keeping it.
     */
    public static BodyReader discarding(RequestHead head) {
        return create(head, null);
    }

    /**
     * Reader that accumulates the body in {@code lease}.
     */
    public static BodyReader into(RequestHead head, BufferPool.Lease lease) {
        return create(head, lease);
    }

    private static BodyReader create(RequestHead head, BufferPool.Lease lease) {
        Framing framing = framingOf(head);
        long length = framing == Framing.FIXED ? head.contentLength().getAsLong() : 0;
        return new BodyReader(framing, length, lease);
    }

    /**
     * Whether the head announces any body bytes at all.
     *
     * @throws RequestParseException if the framing headers conflict or are invalid
     */
    public static boolean hasBody(RequestHead head) {
        return switch (framingOf(head)) {
            case NONE -> false;
            case FIXED -> head.contentLength().getAsLong() > 0;
            case CHUNKED -> true;
        };
    }

    static Framing framingOf(RequestHead head) {
        String te = head.header("transfer-encoding");
        OptionalLong length = head.contentLength();
        if (te != null) {
            if (length.isPresent()) {
                throw RequestParseException.badRequest("Both Content-Length and Transfer-Encoding present");
            }
            if (!head.chunked()) {
                throw RequestParseException.badRequest("Unsupported Transfer-Encoding: " + te);
            }
            return Framing.CHUNKED;
        }
        return length.isPresent() ? Framing.FIXED : Framing.NONE;
    }

    /**
     * Consume body bytes from {@code in}.
     *
     * @return {@code OVERFLOW} once the body no longer fits the lease
     * @throws RequestParseException on malformed chunk framing
     */
    public Progress feed(ByteBuffer in) {
        return switch (framing) {
            case NONE -> Progress.COMPLETE;
            case FIXED -> feedFixed(in);
            case CHUNKED -> feedChunked(in);
        };
    }

    public boolean isDiscarding() {
        return lease == null;
    }

    /**
     * The lease holding the body, or null in discard mode.
     */
    public BufferPool.Lease lease() {
        return lease;
    }

    private Progress feedFixed(ByteBuffer in) {
        if (lease != null && remaining > lease.capacity() - lease.size()) {
            return Progress.OVERFLOW;
        }
        if (!take(in)) {
            return Progress.OVERFLOW;
        }
        return remaining == 0 ? Progress.COMPLETE : Progress.NEED_MORE;
    }

    private Progress feedChunked(ByteBuffer in) {
        while (chunkState != ChunkState.DONE) {
            switch (chunkState) {
                case SIZE_LINE -> {
                    if (!readLine(in)) {
                        return Progress.NEED_MORE;
                    }
                    remaining = chunkSize(line.toString());
                    line.setLength(0);
                    chunkState = remaining == 0 ? ChunkState.TRAILER : ChunkState.DATA;
                }
                case DATA -> {
                    if (!take(in)) {
                        return Progress.OVERFLOW;
                    }
                    if (remaining > 0) {
                        return Progress.NEED_MORE;
                    }
                    chunkState = ChunkState.DATA_END;
                }
                case DATA_END -> {
                    if (!readLine(in)) {
                        return Progress.NEED_MORE;
                    }
                    if (line.length() != 0) {
                        throw RequestParseException.badRequest("Missing CRLF after chunk data");
                    }
                    chunkState = ChunkState.SIZE_LINE;
                }
                case TRAILER -> {
                    if (!readLine(in)) {
                        return Progress.NEED_MORE;
                    }
                    boolean end = line.length() == 0;
                    line.setLength(0);
                    if (end) {
                        chunkState = ChunkState.DONE;
                    }
                }
                default -> throw new IllegalStateException(chunkState.name());
            }
        }
        return Progress.COMPLETE;
    }

    // Moves up to `remaining` bytes out of `in`; false if they did not fit the lease
    private boolean take(ByteBuffer in) {
        int n = (int) Math.min(remaining, in.remaining());
        if (n == 0) {
            return true;
        }
        if (lease != null) {
            ByteBuffer slice = in.duplicate();
            slice.limit(slice.position() + n);
            if (!lease.append(slice)) {
                return false;
            }
        }
        in.position(in.position() + n);
        remaining -= n;
        return true;
    }

    // Accumulates one CRLF-terminated line, without the terminator
    private boolean readLine(ByteBuffer in) {
        while (in.hasRemaining()) {
            char c = (char) (in.get() & 0xff);
            if (c == '\n') {
                int last = line.length() - 1;
                if (last >= 0 && line.charAt(last) == '\r') {
                    line.setLength(last);
                }
                return true;
            }
            if (line.length() >= MAX_LINE) {
                throw RequestParseException.badRequest("Chunk line too long");
            }
            line.append(c);
        }
        return false;
    }

    private static long chunkSize(String sizeLine) {
        int ext = sizeLine.indexOf(';');
        String hex = (ext < 0 ? sizeLine : sizeLine.substring(0, ext)).trim();
        if (hex.isEmpty() || hex.length() > 15) {
            throw RequestParseException.badRequest("Invalid chunk size: " + sizeLine);
        }
        long size = 0;
        for (int i = 0; i < hex.length(); i++) {
            int digit = Character.digit(hex.charAt(i), 16);
            if (digit < 0) {
                throw RequestParseException.badRequest("Invalid chunk size: " + sizeLine);
            }
            size = (size << 4) | digit;
        }
        return size;
    }
}
