package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private String businessArea;
    private String sourceId;
    private String status; // SUCCESS, NO_DOCUMENTS, FAILED
    private int documentsProcessed;
    private int chunksCreated;
    private int documentsAdded;
    private int documentsDeleted;
    private long durationMs;
    private String errorMessage;
}
