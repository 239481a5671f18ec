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
public class AreaAnalysisResult {

    private String businessArea;
    private String status;
    private String reason;

    @Builder.Default
    private Map<String, SourceAnalysisResult> sources = new LinkedHashMap<>();
}
