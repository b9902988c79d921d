package com.forkserve.http.buffer;

import java.nio.ByteBuffer;

/**
 * Fixed set of pre-allocated, fixed-size byte buffers for request bodies.
 *
 * A buffer is handed out as a {@link Lease}; the slot stays unavailable until
 * the lease is closed. When every slot is leased, {@link #acquire()} fails
 * with {@link PoolExhaustedException} instead of handing out a buffer that
 * another request is still writing into.
 *
 * Not thread-safe: each reactor owns its own pool and only touches it from
 * the reactor thread.
 *
 * <pre>{@code
 * try (BufferPool.Lease lease = pool.acquire()) {
 *     if (!lease.append(chunk)) {
 *         // body larger than one buffer
 *     }
 *     decode(lease.array(), 0, lease.size());
 * }
 * }</pre>
 */
public final class BufferPool {

    public static final int DEFAULT_BUFFER_SIZE = 16 * 1024;
    public static final int DEFAULT_SLOTS = 1000;

    private final int bufferSize;
    private final byte[][] buffers;

    // stack of free slot indices; top of stack at freeCount - 1
    private final int[] free;
    private int freeCount;
    private volatile long leases;

    public BufferPool(int bufferSize, int slots) {
        if (bufferSize <= 0 || slots <= 0) {
            throw new IllegalArgumentException("bufferSize and slots must be positive");
        }
        this.bufferSize = bufferSize;
        this.buffers = new byte[slots][];
        this.free = new int[slots];
        for (int i = 0; i < slots; i++) {
            buffers[i] = new byte[bufferSize];
            free[i] = slots - 1 - i;
        }
        this.freeCount = slots;
    }

    public static BufferPool withDefaults() {
        return new BufferPool(DEFAULT_BUFFER_SIZE, DEFAULT_SLOTS);
    }

    /**
     * Lease a buffer. The caller must close the lease when the body has been
     * consumed, on success and on error alike.
     *
     * @throws PoolExhaustedException if every slot is leased
     */
    public Lease acquire() {
        if (freeCount == 0) {
            throw new PoolExhaustedException(buffers.length);
        }
        int slot = free[--freeCount];
        leases++;
        return new Lease(slot);
    }

    public int bufferSize() {
        return bufferSize;
    }

    public int slots() {
        return buffers.length;
    }

    public int available() {
        return freeCount;
    }

    public int inUse() {
        return buffers.length - freeCount;
    }

    /**
     * Total leases handed out since creation.
     */
    public long totalLeases() {
        return leases;
    }

    private void release(int slot) {
        free[freeCount++] = slot;
    }

    @Override
    public String toString() {
        return String.format("BufferPool[slots=%d, inUse=%d, bufferSize=%d]",
                buffers.length, inUse(), bufferSize);
    }

    /**
     * Exclusive use of one pooled buffer until {@link #close()}.
     */
    public final class Lease implements AutoCloseable {
        private final int slot;
        private int size;
        private boolean released;

        private Lease(int slot) {
            this.slot = slot;
        }

        /**
         * Copy all remaining bytes of {@code src} into the buffer.
         *
         * @return false, copying nothing, if the bytes do not fit
         */
        public boolean append(ByteBuffer src) {
            checkOpen();
            int n = src.remaining();
            if (n > bufferSize - size) {
                return false;
            }
            src.get(buffers[slot], size, n);
            size += n;
            return true;
        }

        /**
         * Backing array; only the first {@link #size()} bytes belong to this lease.
         */
        public byte[] array() {
            checkOpen();
            return buffers[slot];
        }

        public int size() {
            return size;
        }

        public int capacity() {
            return bufferSize;
        }

        public boolean isReleased() {
            return released;
        }

        /**
         * Return the slot to the pool. Idempotent.
         */
        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            size = 0;
            release(slot);
        }

        private void checkOpen() {
            if (released) {
                throw new IllegalStateException("lease already released");
            }
        }
    }
}
