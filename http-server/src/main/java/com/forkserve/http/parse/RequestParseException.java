package com.forkserve.http.parse;

/**
 * Protocol-level error in an incoming request. Carries the status the
 * connection answers with before it is closed.
 */
public class RequestParseException extends RuntimeException {

    private final int status;

    public RequestParseException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }

    static RequestParseException badRequest(String message) {
        return new RequestParseException(400, message);
    }
}
