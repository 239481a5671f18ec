package com.architecture.memory.traceback.exception;

public class CodeQlBuildException extends TracebackException {

    public CodeQlBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
