package com.architecture.memory.traceback.service.codeql;

import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.exception.TracebackException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the fixed query battery of a language against one database. A missing or failing
 * query contributes an empty row list and never stops the rest of the battery.
 */
@Service
@Slf4j
public class CodeQlQueryExecutor {

    public static final String CALL_GRAPH = "call_graph";
    public static final String SUBPROCESS_CALLS = "subprocess_calls";
    public static final String IMPORTS = "imports";
    public static final String CLASSES = "classes";

    static final Map<String, List<String>> QUERY_BATTERY = Map.of(
            "python", List.of(CALL_GRAPH, SUBPROCESS_CALLS, IMPORTS),
            "java", List.of(CALL_GRAPH, IMPORTS, CLASSES));

    private final CodeQlCli codeQlCli;
    private final Path queriesPath;

    public CodeQlQueryExecutor(CodeQlCli codeQlCli, TracebackProperties properties) {
        this(codeQlCli, properties.getCodeql().getQueriesPath());
    }

    CodeQlQueryExecutor(CodeQlCli codeQlCli, Path queriesPath) {
        this.codeQlCli = codeQlCli;
        this.queriesPath = queriesPath;
    }

    public List<String> queriesFor(String language) {
        return QUERY_BATTERY.getOrDefault(language, List.of());
    }

    public List<Map<String, Object>> executeQuery(Path databasePath, String language, String queryName) {
        Path queryFile = queriesPath.resolve(language).resolve(queryName + ".ql");
        if (!Files.isRegularFile(queryFile)) {
            log.error("[codeql-query] Query file not found: {}", queryFile);
            return List.of();
        }
        try {
            return codeQlCli.runQuery(databasePath, queryFile);
        } catch (TracebackException e) {
            log.error("[codeql-query] Query {} failed on {}: {}", queryName, databasePath, e.getMessage());
            return List.of();
        }
    }

    /**
     * @return rows per query name, in battery order
     */
    public Map<String, List<Map<String, Object>>> executeAll(Path databasePath, String language) {
        Map<String, List<Map<String, Object>>> results = new LinkedHashMap<>();
        List<String> queries = queriesFor(language);
        if (queries.isEmpty()) {
            log.warn("[codeql-query] No queries defined for language={}", language);
            return results;
        }

        for (String query : queries) {
            List<Map<String, Object>> rows = executeQuery(databasePath, language, query);
            results.put(query, rows);
            log.info("[codeql-query] Executed {} language={} rows={}", query, language, rows.size());
        }
        return results;
    }

    public List<String> listAvailableQueries(String language) {
        Path directory = queriesPath.resolve(language);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(file -> file.getFileName().toString())
                    .filter(name -> name.endsWith(".ql"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("[codeql-query] Could not list {}: {}", directory, e.getMessage());
            return List.of();
        }
    }
}
