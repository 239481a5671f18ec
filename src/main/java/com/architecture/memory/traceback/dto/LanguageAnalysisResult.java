package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-language outcome of one source analysis run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageAnalysisResult {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_CANCELLED = "cancelled";

    private String language;
    private String status;
    private Path databasePath;
    private boolean databaseReused;

    /**
     * Row count per analysis in the query battery.
     */
    @Builder.Default
    private Map<String, Integer> queryResults = new LinkedHashMap<>();

    private GraphEmissionResult graph;
    private String error;
}
