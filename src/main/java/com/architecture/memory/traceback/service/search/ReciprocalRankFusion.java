package com.architecture.memory.traceback.service.search;

import com.architecture.memory.traceback.dto.RankedResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion of a dense and a lexical ranking. Each list contributes
 * {@code 1 / (k + rank)} per item (1-based rank); contributions for the same id are summed.
 */
public final class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private ReciprocalRankFusion() {
    }

    public static List<RankedResult> fuse(List<QdrantRestClient.SearchResult> dense,
                                          List<Bm25Index.ScoredChunk> lexical) {
        return fuse(dense, lexical, DEFAULT_K);
    }

    /**
     * Ordered by descending fused score; equal scores keep first-seen order, dense first.
     * The payload comes from the dense hit when the id appears there.
     */
    public static List<RankedResult> fuse(List<QdrantRestClient.SearchResult> dense,
                                          List<Bm25Index.ScoredChunk> lexical,
                                          int k) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Map<String, Object>> payloads = new HashMap<>();

        int rank = 1;
        for (QdrantRestClient.SearchResult hit : dense) {
            String id = denseId(hit);
            if (id != null) {
                scores.merge(id, 1.0 / (k + rank), Double::sum);
                payloads.put(id, hit.getPayload() == null ? new HashMap<>() : hit.getPayload());
            }
            rank++;
        }

        rank = 1;
        for (Bm25Index.ScoredChunk hit : lexical) {
            String id = hit.id();
            if (id != null) {
                scores.merge(id, 1.0 / (k + rank), Double::sum);
                payloads.putIfAbsent(id, hit.chunk());
            }
            rank++;
        }

        List<RankedResult> fused = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> fused.add(RankedResult.builder()
                .id(id)
                .score(score)
                .payload(payloads.get(id))
                .build()));
        fused.sort(Comparator.comparingDouble(RankedResult::getScore).reversed());
        return fused;
    }

    /**
     * Dense hits are keyed by the chunk id carried in the payload so that they line up with
     * lexical hits; the point id is used only when the payload has none.
     */
    static String denseId(QdrantRestClient.SearchResult hit) {
        Map<String, Object> payload = hit.getPayload();
        if (payload != null) {
            Object id = payload.get("id");
            if (id == null) {
                id = payload.get("document_id");
            }
            if (id != null) {
                return id.toString();
            }
        }
        return hit.getId();
    }
}
