package com.architecture.memory.traceback.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedDocument {

    private String title;
    private String content;
    private String source;
    private String documentType;
    private double score;
    private String url;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
