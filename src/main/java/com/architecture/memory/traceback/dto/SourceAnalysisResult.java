package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceAnalysisResult {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_SKIPPED = "skipped";
    public static final String STATUS_ERROR = "error";

    public static final String REASON_SOURCE_DISABLED = "source_disabled";
    public static final String REASON_AREA_DISABLED = "codeql_not_enabled_for_business_area";
    public static final String REASON_NO_SOURCES = "no_sources_registered";

    private String sourceId;
    private String businessArea;
    private String status;
    private String reason;
    private String error;

    @Builder.Default
    private Map<String, LanguageAnalysisResult> languages = new LinkedHashMap<>();

    public static SourceAnalysisResult skipped(String sourceId, String businessArea, String reason) {
        return SourceAnalysisResult.builder()
                .sourceId(sourceId)
                .businessArea(businessArea)
                .status(STATUS_SKIPPED)
                .reason(reason)
                .build();
    }

    public static SourceAnalysisResult error(String sourceId, String businessArea, String error) {
        return SourceAnalysisResult.builder()
                .sourceId(sourceId)
                .businessArea(businessArea)
                .status(STATUS_ERROR)
                .error(error)
                .build();
    }
}
