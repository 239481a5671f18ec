package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.dto.RankedResult;
import com.architecture.memory.traceback.dto.RetrievalResult;
import com.architecture.memory.traceback.dto.RetrievedDocument;
import com.architecture.memory.traceback.service.search.HybridSearchEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Code units ingested from GitLab projects or local checkouts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CodeRetriever extends HybridSearchRetriever {

    public static final String NAME = "code";

    private static final List<String> CODE_METADATA = List.of(
            "unit_type", "unit_name", "file_path", "file_type", "line_start", "line_end");

    private final HybridSearchEngine hybridSearchEngine;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetrievalResult retrieve(String query, String businessArea, int limit, Map<String, Object> filters) {
        Map<String, Object> codeFilters = new HashMap<>();
        codeFilters.put("document_type", "code");
        codeFilters.put("source", "code");
        if (filters != null) {
            codeFilters.putAll(filters);
        }
        String source = sourceLabel(codeFilters);

        try {
            log.info("[retriever:code] area={} limit={} filters={}", businessArea, limit, codeFilters);
            List<RankedResult> results = hybridSearchEngine.hybridSearch(businessArea, query, limit, codeFilters);

            List<RetrievedDocument> documents = results.stream()
                    .map(this::toCodeDocument)
                    .collect(Collectors.toList());
            return RetrievalResult.of(NAME, source, documents);
        } catch (Exception e) {
            log.error("[retriever:code] Retrieval failed for area={}: {}", businessArea, e.getMessage());
            return RetrievalResult.failure(NAME, source, RetrievalResult.ERROR, e.getMessage());
        }
    }

    private RetrievedDocument toCodeDocument(RankedResult result) {
        RetrievedDocument document = toDocument(result);
        Map<String, Object> payload = result.getPayload() == null ? Map.of() : result.getPayload();
        for (String key : CODE_METADATA) {
            document.getMetadata().putIfAbsent(key, payload.get(key));
        }
        if (document.getDocumentType().isEmpty()) {
            document.setDocumentType("code");
        }
        return document;
    }
}
