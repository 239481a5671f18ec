package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.exception.CodeQlCommandException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Thin adapter over the {@code codeql} executable and the git revision lookup.
 * Each invocation carries its own timeout from {@link TracebackProperties.CodeQl}.
 */
@Component
@Slf4j
public class CodeQlCli {

    private final CommandRunner commandRunner;
    private final TracebackProperties.CodeQl settings;
    private final ObjectMapper objectMapper;

    public CodeQlCli(CommandRunner commandRunner, TracebackProperties properties, ObjectMapper objectMapper) {
        this.commandRunner = commandRunner;
        this.settings = properties.getCodeql();
        this.objectMapper = objectMapper;
    }

    public boolean isAvailable() {
        try {
            String version = version();
            log.debug("[codeql-cli] CodeQL available: {}", version);
            return true;
        } catch (CodeQlCommandException e) {
            log.warn("[codeql-cli] CodeQL not available at '{}': {}", settings.getCliPath(), e.getMessage());
            return false;
        }
    }

    public String version() {
        return commandRunner.run(List.of(settings.getCliPath(), "version", "--format=terse"), null,
                settings.getVersionTimeout()).strip();
    }

    /**
     * {@code codeql database create <db> --language L --source-root S [--command C] --overwrite}
     */
    public Path databaseCreate(Path databasePath, String language, Path sourceRoot, String buildCommand) {
        List<String> command = new ArrayList<>(List.of(
                settings.getCliPath(), "database", "create", databasePath.toString(),
                "--language=" + language,
                "--source-root=" + sourceRoot.toString(),
                "--overwrite"));
        if (buildCommand != null && !buildCommand.isBlank()) {
            command.add("--command=" + buildCommand);
        }

        log.info("[codeql-cli] Creating database {} language={} source={}", databasePath, language, sourceRoot);
        commandRunner.run(command, sourceRoot, settings.getBuildTimeout());
        return databasePath;
    }

    /**
     * Runs one query and decodes its {@code #select} result set into positional rows
     * keyed {@code #1}, {@code #2}, ...
     */
    public List<Map<String, Object>> runQuery(Path databasePath, Path queryFile) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("codeql-query-");
            Path bqrs = workDir.resolve("results.bqrs");

            commandRunner.run(List.of(
                    settings.getCliPath(), "query", "run",
                    "--database=" + databasePath,
                    "--output=" + bqrs,
                    queryFile.toString()), null, settings.getQueryTimeout());

            String json = commandRunner.run(List.of(
                    settings.getCliPath(), "bqrs", "decode",
                    "--format=json",
                    "--result-set=#select",
                    bqrs.toString()), null, settings.getQueryTimeout());

            return parseRows(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new CodeQlCommandException(List.of(settings.getCliPath(), "query"),
                    "Failed to read results of " + queryFile.getFileName() + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(workDir);
        }
    }

    /**
     * HEAD revision of a git checkout, empty when the directory is not a repository.
     */
    public Optional<String> currentRevision(Path repositoryPath) {
        if (!Files.isDirectory(repositoryPath)) {
            return Optional.empty();
        }
        try {
            String revision = commandRunner.run(List.of("git", "rev-parse", "HEAD"), repositoryPath,
                    settings.getVersionTimeout()).strip();
            return revision.isEmpty() ? Optional.empty() : Optional.of(revision);
        } catch (CodeQlCommandException e) {
            log.debug("[codeql-cli] No git revision for {}: {}", repositoryPath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Entity columns decode as objects with a {@code label}; primitive columns as
     * plain values.
     */
    static List<Map<String, Object>> parseRows(JsonNode decoded) {
        JsonNode resultSet = decoded.has("#select") ? decoded.get("#select") : decoded;
        JsonNode tuples = resultSet.path("tuples");

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode tuple : tuples) {
            Map<String, Object> row = new LinkedHashMap<>();
            int column = 1;
            for (JsonNode cell : tuple) {
                row.put("#" + column++, cellValue(cell));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object cellValue(JsonNode cell) {
        if (cell.isObject()) {
            return cell.has("label") ? cell.get("label").asText() : cell.toString();
        }
        if (cell.isInt() || cell.isLong()) {
            return cell.asLong();
        }
        if (cell.isNull()) {
            return null;
        }
        return cell.asText();
    }

    private static void deleteQuietly(Path directory) {
        if (directory == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            log.debug("[codeql-cli] Could not clean {}: {}", directory, e.getMessage());
        }
    }
}
