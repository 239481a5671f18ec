package com.architecture.memory.traceback.exception;

import lombok.Getter;

import java.time.Duration;
import java.util.List;

@Getter
public class CliTimeoutException extends CodeQlCommandException {

    private final Duration timeout;

    public CliTimeoutException(List<String> command, Duration timeout) {
        super(command, "Command timed out after " + timeout.toSeconds() + "s: " + String.join(" ", command), null);
        this.timeout = timeout;
    }
}
