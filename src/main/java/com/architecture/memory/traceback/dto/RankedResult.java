package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A fused search hit. {@code score} is the summed reciprocal-rank contribution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedResult {

    private String id;
    private double score;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();
}
