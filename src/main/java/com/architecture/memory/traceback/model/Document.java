package com.architecture.memory.traceback.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A document as produced by a source fetcher. Ids are globally unique and prefixed by
 * the source, e.g. {@code confluence_12345}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    private String id;
    private String content;
    private String title;
    private SourceType source;
    private DocumentType documentType;
    private String businessArea;
    private Instant lastModified;
    private String url;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
