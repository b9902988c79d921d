package com.forkserve.http.server;

/**
 * Destination of a fully rendered response.
 */
interface ResponseSink {

    /**
     * Queue {@code bytes} for writing. Callable from any thread; the write
     * itself happens on the connection's reactor.
     *
     * @param close half-close the connection once the bytes are flushed
     */
    void respond(byte[] bytes, boolean close);
}
