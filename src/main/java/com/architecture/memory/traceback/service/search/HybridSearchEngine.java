package com.architecture.memory.traceback.service.search;

import com.architecture.memory.traceback.dto.RankedResult;
import com.architecture.memory.traceback.exception.ExternalServiceUnavailableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Hybrid retrieval over one business area: dense search in Qdrant plus BM25 over the
 * area's ingested chunks, fused with reciprocal rank fusion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridSearchEngine {

    private final EmbeddingModel embeddingModel;
    private final QdrantRestClient qdrantClient;
    private final LexicalIndexRegistry lexicalIndexRegistry;

    public void rebuildLexicalIndex(String businessArea, List<Map<String, Object>> chunks) {
        lexicalIndexRegistry.rebuild(businessArea, chunks);
    }

    public void updateLexicalIndex(String businessArea, String sourceId, List<Map<String, Object>> chunks,
                                   Collection<String> replacedDocumentIds, boolean fullSync) {
        lexicalIndexRegistry.updateSource(businessArea, sourceId, chunks, replacedDocumentIds, fullSync);
    }

    public List<QdrantRestClient.SearchResult> denseSearch(String businessArea, String query, int limit,
                                                           Map<String, Object> filters) {
        List<Float> vector;
        try {
            vector = embeddingModel.embed(query).content().vectorAsList();
        } catch (Exception e) {
            log.error("[hybrid-search] Query embedding failed for area={}: {}", businessArea, e.getMessage());
            throw new ExternalServiceUnavailableException("embedding", e.getMessage(), e);
        }
        List<QdrantRestClient.SearchResult> results = qdrantClient.search(businessArea, vector, limit, filters);
        log.debug("[hybrid-search] Dense search area={} results={}", businessArea, results.size());
        return results;
    }

    public List<Bm25Index.ScoredChunk> bm25Search(String businessArea, String query, int limit) {
        return bm25Search(businessArea, query, limit, Map.of());
    }

    /**
     * Lexical search restricted to chunks whose payload matches every filter. Returns an
     * empty list when the area has not been indexed yet.
     */
    public List<Bm25Index.ScoredChunk> bm25Search(String businessArea, String query, int limit,
                                                  Map<String, Object> filters) {
        return lexicalIndexRegistry.withIndex(businessArea, index -> {
                    List<Bm25Index.ScoredChunk> ranked = index.search(query, index.size());
                    return ranked.stream()
                            .filter(hit -> matches(hit.chunk(), filters))
                            .limit(limit)
                            .collect(Collectors.toList());
                })
                .orElseGet(() -> {
                    log.warn("[hybrid-search] BM25 index not found for area={}", businessArea);
                    return List.of();
                });
    }

    public List<RankedResult> hybridSearch(String businessArea, String query, int topK) {
        return hybridSearch(businessArea, query, topK, Map.of());
    }

    /**
     * Each side is asked for {@code 2 * topK} candidates before fusion. Dense failures
     * propagate; a missing lexical index degrades to dense-only ranking.
     */
    public List<RankedResult> hybridSearch(String businessArea, String query, int topK, Map<String, Object> filters) {
        int candidates = topK * 2;
        List<QdrantRestClient.SearchResult> dense = denseSearch(businessArea, query, candidates, filters);
        List<Bm25Index.ScoredChunk> lexical = bm25Search(businessArea, query, candidates, filters);

        List<RankedResult> fused = ReciprocalRankFusion.fuse(dense, lexical);
        List<RankedResult> top = fused.size() > topK ? fused.subList(0, topK) : fused;

        log.info("[hybrid-search] area={} dense={} bm25={} fused={} returned={}",
                businessArea, dense.size(), lexical.size(), fused.size(), top.size());
        return List.copyOf(top);
    }

    static boolean matches(Map<String, Object> payload, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            if (filter.getValue() == null) {
                continue;
            }
            Object actual = payload.get(filter.getKey());
            if (actual == null) {
                return false;
            }
            if (filter.getValue() instanceof Collection<?> accepted) {
                boolean any = accepted.stream().anyMatch(v -> Objects.equals(String.valueOf(v), String.valueOf(actual)));
                if (!any) {
                    return false;
                }
            } else if (!Objects.equals(String.valueOf(filter.getValue()), String.valueOf(actual))) {
                return false;
            }
        }
        return true;
    }
}
