package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.dto.RankedResult;
import com.architecture.memory.traceback.dto.RetrievalResult;
import com.architecture.memory.traceback.dto.RetrievedDocument;
import com.architecture.memory.traceback.service.search.HybridSearchEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data lineage assets from OpenMetadata. When the direct hits leave room under the
 * limit, related entities listed in the lineage content are looked up as well.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LineageRetriever extends HybridSearchRetriever {

    public static final String NAME = "lineage";

    static final double RELATED_SCORE_FACTOR = 0.8;

    private final HybridSearchEngine hybridSearchEngine;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetrievalResult retrieve(String query, String businessArea, int limit, Map<String, Object> filters) {
        Map<String, Object> lineageFilters = new HashMap<>();
        lineageFilters.put("source", "openmetadata");
        if (filters != null) {
            lineageFilters.putAll(filters);
        }
        String source = sourceLabel(lineageFilters);

        try {
            List<RetrievedDocument> documents = new ArrayList<>();
            Set<String> seenEntities = new HashSet<>();

            for (RankedResult result : hybridSearchEngine.hybridSearch(businessArea, query, limit, lineageFilters)) {
                String fqn = entityName(result.getPayload());
                if (fqn != null && !seenEntities.add(fqn)) {
                    continue;
                }
                documents.add(toLineageDocument(result, fqn, 1.0, false));
            }

            if (!documents.isEmpty() && documents.size() < limit) {
                List<String> related = extractRelatedEntities(documents);
                for (String entity : related) {
                    if (documents.size() >= limit) {
                        break;
                    }
                    if (seenEntities.contains(entity)) {
                        continue;
                    }
                    for (RankedResult result : hybridSearchEngine.hybridSearch(businessArea, entity, 1, lineageFilters)) {
                        String fqn = entityName(result.getPayload());
                        if (fqn != null && seenEntities.add(fqn)) {
                            documents.add(toLineageDocument(result, fqn, RELATED_SCORE_FACTOR, true));
                        }
                    }
                }
            }

            log.info("[retriever:lineage] area={} documents={}", businessArea, documents.size());
            RetrievalResult result = RetrievalResult.of(NAME, source, documents);
            if (!documents.isEmpty()) {
                result.setMessage("Retrieved " + documents.size() + " lineage documents");
            }
            return result;
        } catch (Exception e) {
            log.error("[retriever:lineage] Retrieval failed for area={}: {}", businessArea, e.getMessage());
            return RetrievalResult.failure(NAME, source, RetrievalResult.ERROR, e.getMessage());
        }
    }

    private RetrievedDocument toLineageDocument(RankedResult result, String fqn, double factor, boolean related) {
        RetrievedDocument document = toDocument(result);
        document.setScore(result.getScore() * factor);
        document.getMetadata().put("fully_qualified_name", fqn);
        if (related) {
            document.getMetadata().put("is_related", true);
        }
        return document;
    }

    private static String entityName(Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        Object fqn = payload.get("fully_qualified_name");
        if (fqn == null) {
            fqn = payload.get("entity_fqn");
        }
        return fqn == null ? null : fqn.toString();
    }

    /**
     * Entity references are list items such as {@code - warehouse.sales.orders}.
     */
    static List<String> extractRelatedEntities(List<RetrievedDocument> documents) {
        Set<String> entities = new LinkedHashSet<>();
        for (RetrievedDocument document : documents) {
            if (document.getContent() == null) {
                continue;
            }
            for (String line : document.getContent().split("\n")) {
                String trimmed = line.trim();
                if (trimmed.startsWith("- ") && (trimmed.contains(".") || trimmed.contains("/"))) {
                    String entity = trimmed.substring(2).trim();
                    if (entity.length() > 3) {
                        entities.add(entity);
                    }
                }
            }
        }
        return new ArrayList<>(entities);
    }
}
