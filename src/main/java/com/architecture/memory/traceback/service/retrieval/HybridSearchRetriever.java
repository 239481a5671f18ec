package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.dto.RankedResult;
import com.architecture.memory.traceback.dto.RetrievedDocument;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Shared payload mapping for retrievers backed by the hybrid search engine.
 */
abstract class HybridSearchRetriever implements Retriever {

    static final Set<String> DOCUMENT_FIELDS = Set.of("title", "content", "source", "document_type", "url");

    protected RetrievedDocument toDocument(RankedResult result) {
        Map<String, Object> payload = result.getPayload() == null ? Map.of() : result.getPayload();

        Map<String, Object> metadata = new HashMap<>();
        payload.forEach((key, value) -> {
            if (!DOCUMENT_FIELDS.contains(key)) {
                metadata.put(key, value);
            }
        });

        return RetrievedDocument.builder()
                .title(stringValue(payload.get("title")))
                .content(stringValue(payload.get("content")))
                .source(stringValue(payload.get("source")))
                .documentType(stringValue(payload.get("document_type")))
                .score(result.getScore())
                .url(payload.get("url") == null ? null : payload.get("url").toString())
                .metadata(metadata)
                .build();
    }

    protected static String sourceLabel(Map<String, Object> filters) {
        Object source = filters == null ? null : filters.get("source");
        return source == null ? "all" : source.toString();
    }

    protected static String stringValue(Object value) {
        return value == null ? "" : value.toString();
    }
}
