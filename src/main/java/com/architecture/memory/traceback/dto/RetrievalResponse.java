package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResponse {

    private String businessArea;
    private String query;
    private Map<String, List<RetrievalResult>> results;
    private int totalDocuments;
    private long processingTimeMs;
}
