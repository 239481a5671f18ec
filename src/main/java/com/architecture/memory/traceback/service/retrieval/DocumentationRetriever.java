package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.dto.RankedResult;
import com.architecture.memory.traceback.dto.RetrievalResult;
import com.architecture.memory.traceback.dto.RetrievedDocument;
import com.architecture.memory.traceback.service.search.HybridSearchEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Requirements, wiki and configuration documents (Confluence, Firestore).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentationRetriever extends HybridSearchRetriever {

    public static final String NAME = "docs";

    private final HybridSearchEngine hybridSearchEngine;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetrievalResult retrieve(String query, String businessArea, int limit, Map<String, Object> filters) {
        String source = sourceLabel(filters);
        try {
            log.info("[retriever:docs] area={} limit={} filters={}", businessArea, limit, filters);
            List<RankedResult> results = hybridSearchEngine.hybridSearch(businessArea, query, limit,
                    filters == null ? Map.of() : filters);

            List<RetrievedDocument> documents = results.stream()
                    .map(this::toDocument)
                    .collect(Collectors.toList());
            if (documents.isEmpty()) {
                log.warn("[retriever:docs] No results for area={}", businessArea);
            }
            return RetrievalResult.of(NAME, source, documents);
        } catch (Exception e) {
            log.error("[retriever:docs] Retrieval failed for area={}: {}", businessArea, e.getMessage());
            return RetrievalResult.failure(NAME, source, RetrievalResult.ERROR, e.getMessage());
        }
    }
}
