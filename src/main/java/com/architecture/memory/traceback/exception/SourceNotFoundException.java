package com.architecture.memory.traceback.exception;

import lombok.Getter;

@Getter
public class SourceNotFoundException extends TracebackException {

    private final String sourceId;

    public SourceNotFoundException(String sourceId) {
        super("Source not found: " + sourceId);
        this.sourceId = sourceId;
    }
}
