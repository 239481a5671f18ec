package com.architecture.memory.traceback.exception;

import lombok.Getter;

import java.util.List;

/**
 * A CodeQL or git invocation that exited non-zero or could not be started.
 */
@Getter
public class CodeQlCommandException extends TracebackException {

    private final List<String> command;
    private final int exitCode;

    public CodeQlCommandException(List<String> command, int exitCode, String output) {
        super("Command " + command.get(0) + " " + (command.size() > 1 ? command.get(1) : "")
                + " failed with exit code " + exitCode + ": " + output);
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
    }

    public CodeQlCommandException(List<String> command, String message, Throwable cause) {
        super(message, cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
    }
}
