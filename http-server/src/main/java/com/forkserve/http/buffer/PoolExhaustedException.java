package com.forkserve.http.buffer;

/**
 * Every slot of a {@link BufferPool} is leased.
 */
public class PoolExhaustedException extends RuntimeException {

    private final int slots;

    public PoolExhaustedException(int slots) {
        super("buffer pool exhausted: all " + slots + " slots in use");
        this.slots = slots;
    }

    public int slots() {
        return slots;
    }
}
