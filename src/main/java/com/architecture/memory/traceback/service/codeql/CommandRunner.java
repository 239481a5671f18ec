package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.exception.CliTimeoutException;
import com.architecture.memory.traceback.exception.CodeQlCommandException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external processes with a hard timeout. Output (stdout and stderr merged) is
 * spooled to a temp file so a chatty process can never block on a full pipe.
 */
@Component
@Slf4j
public class CommandRunner {

    private static final int OUTPUT_TAIL_CHARS = 2000;

    public String run(List<String> command, Path workingDirectory, Duration timeout) {
        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("traceback-cmd-", ".log");

            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(outputFile.toFile());
            if (workingDirectory != null) {
                processBuilder.directory(workingDirectory.toFile());
            }

            log.debug("[cmd] Running {} (timeout={}s)", command, timeout.toSeconds());
            Process process = processBuilder.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.error("[cmd] Timed out after {}s: {}", timeout.toSeconds(), command);
                throw new CliTimeoutException(command, timeout);
            }

            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.error("[cmd] {} exited with code {}", command.subList(0, Math.min(3, command.size())), exitCode);
                throw new CodeQlCommandException(command, exitCode, tail(output));
            }
            return output;
        } catch (IOException e) {
            throw new CodeQlCommandException(command, "Failed to run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CodeQlCommandException(command, "Interrupted while running " + command.get(0), e);
        } finally {
            if (outputFile != null) {
                try {
                    Files.deleteIfExists(outputFile);
                } catch (IOException e) {
                    log.debug("[cmd] Could not delete {}: {}", outputFile, e.getMessage());
                }
            }
        }
    }

    private static String tail(String output) {
        String trimmed = output.strip();
        return trimmed.length() <= OUTPUT_TAIL_CHARS ? trimmed : trimmed.substring(trimmed.length() - OUTPUT_TAIL_CHARS);
    }
}
