package com.architecture.memory.traceback.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
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
public class CodeSourceRequest {

    @NotBlank(message = "Source type is required")
    private String sourceType;

    @NotBlank(message = "Path is required")
    private String path;

    @NotEmpty(message = "At least one language is required")
    private List<String> languages;

    private String name;
    private String sourceId;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
