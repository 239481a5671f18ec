package com.architecture.memory.traceback.exception;

import lombok.Getter;

/**
 * The vector index, graph store or embedding provider could not be reached.
 */
@Getter
public class ExternalServiceUnavailableException extends TracebackException {

    private final String service;

    public ExternalServiceUnavailableException(String service, String message, Throwable cause) {
        super(service + " unavailable: " + message, cause);
        this.service = service;
    }
}
