package com.architecture.memory.traceback.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalRequest {

    @NotBlank(message = "Query is required")
    private String query;

    /**
     * Restricts retrieval to these sources. Null means every configured source.
     */
    private List<String> sources;

    @Min(1)
    @Max(50)
    @Builder.Default
    private int limit = 5;

    @Builder.Default
    private Map<String, Object> filters = new HashMap<>();
}
