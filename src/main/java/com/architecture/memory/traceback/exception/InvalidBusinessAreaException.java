package com.architecture.memory.traceback.exception;

import lombok.Getter;

import java.util.Collection;

@Getter
public class InvalidBusinessAreaException extends TracebackException {

    private final String businessArea;

    public InvalidBusinessAreaException(String businessArea, Collection<String> knownAreas) {
        super("Invalid business area: " + businessArea + ". Must be one of " + knownAreas);
        this.businessArea = businessArea;
    }
}
