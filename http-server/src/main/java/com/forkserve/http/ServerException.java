package com.forkserve.http;

/**
 * Lifecycle failure of the server: bind errors, spawn errors, illegal state
 * transitions.
 */
public class ServerException extends RuntimeException {

    public ServerException(String message) {
        super(message);
    }

    public ServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
