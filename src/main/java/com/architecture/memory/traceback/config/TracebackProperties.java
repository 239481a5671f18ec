package com.architecture.memory.traceback.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "traceback")
public class TracebackProperties {

    private List<String> businessAreas = new ArrayList<>(List.of("pharmacy", "supply_chain"));

    /**
     * Per-area source declarations, {@code area:source(key=value,...)} separated by ';'.
     */
    private String sourcesConfig = "";

    /**
     * Per-area retriever overrides, {@code area:source=retriever|retriever} separated by ';'.
     */
    private String retrieverOverrides = "";

    private Retrieval retrieval = new Retrieval();
    private Ingestion ingestion = new Ingestion();
    private CodeQl codeql = new CodeQl();

    @Data
    public static class Retrieval {
        private int defaultLimit = 5;
        private int maxLimit = 50;
        private int poolSize = 8;
    }

    @Data
    public static class Ingestion {
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private int batchSize = 100;
    }

    @Data
    public static class CodeQl {
        private boolean enabled = false;
        private String cliPath = "codeql";
        private Path databasePath = Path.of("data", "codeql-databases");
        private Path registryPath = Path.of("data", "code_source_registry.json");
        private Path workspacePath = Path.of("data", "codeql-workspace");
        private Path queriesPath = Path.of("codeql", "queries");
        private String gitlabUrl = "https://gitlab.com";
        private Duration buildTimeout = Duration.ofHours(1);
        private Duration queryTimeout = Duration.ofMinutes(5);
        private Duration versionTimeout = Duration.ofSeconds(10);
        private Duration gitTimeout = Duration.ofMinutes(10);
        private String refreshCron = "-";
    }
}
