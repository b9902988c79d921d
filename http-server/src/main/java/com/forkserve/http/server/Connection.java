package com.forkserve.http.server;

import com.forkserve.base.Result;
import com.forkserve.http.HttpServer.Handler;
import com.forkserve.http.HttpServer.Request;
import com.forkserve.http.ServerConfig.ConnectionConfig;
import com.forkserve.http.buffer.BufferPool;
import com.forkserve.http.buffer.PoolExhaustedException;
import com.forkserve.http.parse.BodyReader;
import com.forkserve.http.parse.RequestHead;
import com.forkserve.http.parse.RequestHeadParser;
import com.forkserve.http.parse.RequestParseException;
import com.forkserve.http.parse.RequestParser;
import com.forkserve.http.routing.RouteRegistry;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.Optional;

import static com.forkserve.observe.Log.*;

/**
 * One accepted socket and the request currently travelling through it.
 *
 * Confined to its reactor thread except for {@link #respond(byte[], boolean)},
 * which hands the bytes over through the reactor's task queue.
 *
 * Lifecycle per request:
 * <pre>
 *   IDLE ──head──▶ BODY ──body complete──▶ IN_FLIGHT ──response──▶ IDLE
 *                                                      └─close────▶ CLOSING ──peer EOF──▶ CLOSED
 * </pre>
 * Reading pauses while a request is in flight, so pipelined requests wait in
 * the inbound buffer and are answered in order.
 */
final class Connection implements ResponseSink {

    enum State { IDLE, BODY, IN_FLIGHT, CLOSING, CLOSED }

    private final SocketChannel channel;
    private final Reactor reactor;
    private final ServerRuntime runtime;
    private final int maxHeaderSize;
    private final long keepAliveMillis;
    private final long keepAliveNanos;
    private final long requestTimeoutNanos;

    // kept in write mode between events
    private final ByteBuffer inbound;
    private final ArrayDeque<ByteBuffer> outbound = new ArrayDeque<>();

    private SelectionKey key;
    private State state = State.IDLE;
    private boolean processing;
    private boolean draining;
    private boolean closeAfterFlush;
    private boolean outputShut;

    private RequestHead head;
    private Handler handler;
    private BodyReader body;

    private long idleSince;
    private long requestStart = -1;
    private long closingSince;

    Connection(SocketChannel channel, Reactor reactor, ServerRuntime runtime, ConnectionConfig config) {
        this.channel = channel;
        this.reactor = reactor;
        this.runtime = runtime;
        this.maxHeaderSize = config.maxHeaderSize();
        this.keepAliveMillis = config.keepAliveMillis();
        this.keepAliveNanos = config.keepAliveTimeout().toNanos();
        this.requestTimeoutNanos = config.requestTimeout().toNanos();
        this.inbound = ByteBuffer.allocate(Math.max(2 * maxHeaderSize, 16 * 1024));
        this.idleSince = System.nanoTime();
    }

    void attach(SelectionKey key) {
        this.key = key;
    }

    State state() {
        return state;
    }

    // ========================================================================
    // Selector events
    // ========================================================================

    void onReadable() {
        if (state == State.CLOSING) {
            discardUntilEof();
            return;
        }
        if (readAvailable() < 0) {
            close();
            return;
        }
        pump();
    }

    void onWritable() {
        flush();
    }

    /**
     * Stop taking new requests: the current one finishes, anything already
     * buffered is answered 503, then the output side is shut.
     */
    void drain() {
        draining = true;
        pump();
    }

    /**
     * Close on keep-alive idle, request read timeout, or a half-closed peer
     * that never hangs up.
     */
    void sweep(long now) {
        switch (state) {
            case IDLE -> {
                if (inbound.position() == 0 && requestStart < 0) {
                    if (now - idleSince > keepAliveNanos) {
                        debug("Closing idle connection {}", this);
                        close();
                    }
                } else if (requestStart >= 0 && now - requestStart > requestTimeoutNanos) {
                    requestTimedOut();
                }
            }
            case BODY -> {
                if (now - requestStart > requestTimeoutNanos) {
                    requestTimedOut();
                }
            }
            case CLOSING -> {
                if (now - closingSince > keepAliveNanos) {
                    close();
                }
            }
            default -> {
            }
        }
    }

    // ========================================================================
    // Request processing
    // ========================================================================

    private void pump() {
        if (processing || state == State.CLOSED) {
            return;
        }
        processing = true;
        try {
            boolean again = true;
            while (again) {
                again = false;
                while ((state == State.IDLE || state == State.BODY) && outbound.isEmpty() && step()) {
                    // keep going while complete requests are buffered
                }
                if (draining && state == State.IDLE && outbound.isEmpty() && inbound.position() == 0) {
                    int n = readAvailable();
                    if (n < 0) {
                        close();
                    } else if (n > 0) {
                        again = true;
                    } else {
                        halfClose();
                    }
                }
            }
        } catch (RequestParseException e) {
            debug("Rejecting request with {}: {}", e.status(), e.getMessage());
            releaseLease();
            respondStatic(e.status(), HttpStatus.reason(e.status()), false);
        } finally {
            processing = false;
        }
        updateInterest();
    }

    private boolean step() {
        inbound.flip();
        try {
            return state == State.IDLE ? readHead() : readBody();
        } finally {
            if (state != State.CLOSED) {
                inbound.compact();
            }
        }
    }

    private boolean readHead() {
        if (!inbound.hasRemaining()) {
            return false;
        }
        if (requestStart < 0) {
            requestStart = System.nanoTime();
        }
        Optional<RequestHead> parsed = RequestHeadParser.parse(inbound, maxHeaderSize);
        if (parsed.isEmpty()) {
            return false;
        }
        head = parsed.get();

        if (runtime.isShuttingDown()) {
            respondStatic(503, StaticResponses.SHUTTING_DOWN, false);
            return true;
        }

        String method = head.method();
        handler = runtime.routes().resolve(method, head.url()).orElse(null);

        if (handler != null && !RequestParser.skipsBody(method) && BodyReader.hasBody(head)) {
            BufferPool.Lease lease;
            try {
                lease = reactor.pool().acquire();
            } catch (PoolExhaustedException e) {
                warn("Rejecting {} {}: {}", method, head.url(), e.getMessage());
                respondStatic(503, StaticResponses.BUSY, false);
                return true;
            }
            body = BodyReader.into(head, lease);
        } else {
            body = BodyReader.discarding(head);
        }
        state = State.BODY;
        return true;
    }

    private boolean readBody() {
        switch (body.feed(inbound)) {
            case NEED_MORE:
                return false;
            case OVERFLOW:
                debug("Request body exceeds {} bytes, terminating connection", reactor.pool().bufferSize());
                close();
                return false;
            default:
                complete();
                return true;
        }
    }

    private void complete() {
        Object decoded = body.isDiscarding()
                ? RequestParser.EMPTY_BODY
                : RequestParser.decodeBody(body.lease());
        releaseLease();
        body = null;
        requestStart = -1;
        state = State.IN_FLIGHT;

        boolean keepAlive = head.keepAlive();
        if (handler == null) {
            respondStatic(404, StaticResponses.NOT_FOUND, keepAlive);
            return;
        }

        Request request = RequestParser.toRequest(head, decoded);
        ResponseWriter writer = new ResponseWriter(
                this,
                RouteRegistry.routeKey(head.method(), head.url()),
                isHead(),
                keepAlive,
                keepAliveMillis,
                runtime.responseCache());
        runtime.dispatch(handler, request, writer);
    }

    private void requestTimedOut() {
        debug("Request not received within timeout on {}", this);
        releaseLease();
        body = null;
        respondStatic(408, HttpStatus.reason(408), false);
    }

    private boolean isHead() {
        return head != null && "HEAD".equals(head.method());
    }

    // ========================================================================
    // Responses
    // ========================================================================

    @Override
    public void respond(byte[] bytes, boolean close) {
        if (reactor.inReactorThread()) {
            deliver(bytes, close);
        } else {
            reactor.execute(() -> deliver(bytes, close));
        }
    }

    private void respondStatic(int status, String text, boolean keepAlive) {
        deliver(StaticResponses.plain(status, text, keepAlive, isHead()), !keepAlive);
    }

    private void deliver(byte[] bytes, boolean close) {
        if (state == State.CLOSED) {
            debug("Dropping response for closed connection {}", this);
            return;
        }
        outbound.add(ByteBuffer.wrap(bytes));
        head = null;
        handler = null;
        if (close) {
            closeAfterFlush = true;
            state = State.CLOSING;
            closingSince = System.nanoTime();
        } else {
            state = State.IDLE;
            idleSince = System.nanoTime();
        }
        flush();
    }

    private void flush() {
        try {
            while (!outbound.isEmpty()) {
                ByteBuffer next = outbound.peek();
                channel.write(next);
                if (next.hasRemaining()) {
                    updateInterest();
                    return;
                }
                outbound.poll();
            }
        } catch (IOException e) {
            debug("Write failed on {}: {}", this, e.getMessage());
            close();
            return;
        }

        if (closeAfterFlush) {
            shutdownOutput();
        } else if (state == State.IDLE) {
            pump();
        }
        if (!processing) {
            updateInterest();
        }
    }

    // ========================================================================
    // I/O helpers
    // ========================================================================

    // bytes read, or -1 once the peer has closed or the socket failed
    private int readAvailable() {
        int total = 0;
        try {
            while (inbound.hasRemaining()) {
                int n = channel.read(inbound);
                if (n < 0) {
                    return -1;
                }
                if (n == 0) {
                    break;
                }
                total += n;
            }
        } catch (IOException e) {
            debug("Read failed on {}: {}", this, e.getMessage());
            return -1;
        }
        return total;
    }

    private void discardUntilEof() {
        try {
            int n;
            do {
                inbound.clear();
                n = channel.read(inbound);
            } while (n > 0);
            if (n < 0) {
                close();
            }
        } catch (IOException e) {
            close();
        }
    }

    private void halfClose() {
        closeAfterFlush = true;
        state = State.CLOSING;
        closingSince = System.nanoTime();
        shutdownOutput();
    }

    private void shutdownOutput() {
        if (outputShut) {
            return;
        }
        outputShut = true;
        try {
            channel.shutdownOutput();
        } catch (IOException e) {
            debug("Half-close failed on {}: {}", this, e.getMessage());
            close();
        }
    }

    private void updateInterest() {
        if (state == State.CLOSED || key == null || !key.isValid()) {
            return;
        }
        int ops = outbound.isEmpty() ? 0 : SelectionKey.OP_WRITE;
        boolean read = switch (state) {
            case IDLE, BODY -> outbound.isEmpty() && inbound.hasRemaining();
            case CLOSING -> true;
            default -> false;
        };
        if (read) {
            ops |= SelectionKey.OP_READ;
        }
        key.interestOps(ops);
    }

    private void releaseLease() {
        if (body != null && body.lease() != null) {
            body.lease().close();
        }
    }

    /**
     * Close immediately and leave the active set. Idempotent.
     */
    void close() {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        releaseLease();
        outbound.clear();
        if (key != null) {
            key.cancel();
        }
        Result.run(channel::close)
                .onFailure(e -> debug("Error closing connection: {}", e.getMessage()));
        reactor.connections().remove(this);
    }

    @Override
    public String toString() {
        return "Connection[" + Result.of(channel::getRemoteAddress).map(Object::toString).getOrElse("?") + ", " + state + "]";
    }
}
