package com.architecture.memory.traceback.exception;

/**
 * Base type for errors raised by retrieval and code graph operations.
 */
public class TracebackException extends RuntimeException {

    public TracebackException(String message) {
        super(message);
    }

    public TracebackException(String message, Throwable cause) {
        super(message, cause);
    }
}
