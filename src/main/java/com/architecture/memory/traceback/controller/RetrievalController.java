package com.architecture.memory.traceback.controller;

import com.architecture.memory.traceback.dto.RetrievalRequest;
import com.architecture.memory.traceback.dto.RetrievalResponse;
import com.architecture.memory.traceback.dto.RetrievalResult;
import com.architecture.memory.traceback.service.retrieval.RetrieverDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Retrieval over every source configured for a business area.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class RetrievalController {

    private final RetrieverDispatcher retrieverDispatcher;

    /**
     * POST /api/areas/{area}/retrieve
     *
     * {
     *   "query": "refill eligibility rules",
     *   "sources": ["confluence", "code"],
     *   "limit": 5,
     *   "filters": {"document_type": "requirement"}
     * }
     */
    @PostMapping("/areas/{area}/retrieve")
    public ResponseEntity<RetrievalResponse> retrieve(@PathVariable String area,
                                                      @Valid @RequestBody RetrievalRequest request) {
        log.info("[Retrieval Controller] area={} query='{}' sources={}", area, request.getQuery(), request.getSources());
        long start = System.currentTimeMillis();

        Map<String, List<RetrievalResult>> results = retrieverDispatcher.retrieve(
                request.getQuery(), area, request.getLimit(), request.getSources(), request.getFilters());

        return ResponseEntity.ok(RetrievalResponse.builder()
                .businessArea(area)
                .query(request.getQuery())
                .results(results)
                .totalDocuments(RetrieverDispatcher.countDocuments(results))
                .processingTimeMs(System.currentTimeMillis() - start)
                .build());
    }

    @GetMapping("/retrievers")
    public ResponseEntity<Set<String>> retrievers() {
        return ResponseEntity.ok(retrieverDispatcher.availableRetrievers());
    }
}
