package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.config.SourceConfig;
import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.dto.RetrievalResult;
import com.architecture.memory.traceback.exception.InvalidBusinessAreaException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fans a query out to the retrievers configured for each source of a business area.
 *
 * <p>Every (source, retriever) pair runs concurrently on the retrieval pool. A failing or
 * missing retriever produces a failed {@link RetrievalResult} in its own slot and never
 * affects the other slots.
 */
@Service
@Slf4j
public class RetrieverDispatcher {

    public static final Map<String, List<String>> DEFAULT_SOURCE_RETRIEVERS = Map.of(
            "confluence", List.of(DocumentationRetriever.NAME),
            "firestore", List.of(DocumentationRetriever.NAME),
            "gitlab", List.of(CodeRetriever.NAME),
            "code", List.of(CodeRetriever.NAME),
            "openmetadata", List.of(LineageRetriever.NAME),
            "codeql", List.of(GraphRetriever.NAME)
    );

    static final String NO_RETRIEVER_NAME = "none";

    private final SourceConfigResolver sourceConfigResolver;
    private final RetrieverRegistry retrieverRegistry;
    private final Executor retrievalExecutor;
    private final int maxLimit;

    public RetrieverDispatcher(SourceConfigResolver sourceConfigResolver,
                               RetrieverRegistry retrieverRegistry,
                               @Qualifier("retrievalExecutor") Executor retrievalExecutor,
                               TracebackProperties properties) {
        this.sourceConfigResolver = sourceConfigResolver;
        this.retrieverRegistry = retrieverRegistry;
        this.retrievalExecutor = retrievalExecutor;
        this.maxLimit = properties.getRetrieval().getMaxLimit();
    }

    public Set<String> availableRetrievers() {
        return retrieverRegistry.names();
    }

    public Map<String, List<RetrievalResult>> retrieve(String query, String businessArea, int limit) {
        return retrieve(query, businessArea, limit, null, null);
    }

    /**
     * @param sources optional subset of the configured sources; unknown names are ignored
     * @param filters optional payload filters; {@code source} defaults to the source name
     * @return results per source in configuration order
     * @throws InvalidBusinessAreaException when the area is not configured
     */
    public Map<String, List<RetrievalResult>> retrieve(String query, String businessArea, int limit,
                                                       List<String> sources, Map<String, Object> filters) {
        if (!sourceConfigResolver.isKnownArea(businessArea)) {
            throw new InvalidBusinessAreaException(businessArea, sourceConfigResolver.businessAreas());
        }
        String area = businessArea.toLowerCase(Locale.ROOT);
        int effectiveLimit = Math.max(1, Math.min(limit, maxLimit));
        if (effectiveLimit != limit) {
            log.warn("[dispatcher] limit {} outside 1..{} for area={}, using {}", limit, maxLimit, area, effectiveLimit);
        }

        LinkedHashMap<String, SourceConfig> sourceConfigs = sourceConfigResolver.resolveSources(area);
        if (sourceConfigs.isEmpty()) {
            log.warn("[dispatcher] No sources configured for area={}", area);
        }
        if (sources != null && !sources.isEmpty()) {
            Set<String> requested = normalized(sources);
            sourceConfigs.keySet().retainAll(requested);
        }

        Map<String, List<String>> overrides = sourceConfigResolver.resolveOverrides(area);
        Map<String, List<CompletableFuture<RetrievalResult>>> pending = new LinkedHashMap<>();

        for (String sourceName : sourceConfigs.keySet()) {
            List<String> retrieverNames = overrides.getOrDefault(sourceName, DEFAULT_SOURCE_RETRIEVERS.get(sourceName));
            if (retrieverNames == null || retrieverNames.isEmpty()) {
                log.error("[dispatcher] No retriever configured for area={} source={}", area, sourceName);
                pending.put(sourceName, List.of(CompletableFuture.completedFuture(RetrievalResult.failure(
                        NO_RETRIEVER_NAME, sourceName, RetrievalResult.NO_RETRIEVER,
                        "No retriever configured for source '" + sourceName + "'"))));
                continue;
            }

            Map<String, Object> combinedFilters = new HashMap<>();
            if (filters != null) {
                combinedFilters.putAll(filters);
            }
            combinedFilters.putIfAbsent("source", sourceName);

            List<CompletableFuture<RetrievalResult>> slots = new ArrayList<>();
            for (String retrieverName : retrieverNames) {
                slots.add(dispatch(query, area, effectiveLimit, sourceName, retrieverName, Collections.unmodifiableMap(combinedFilters)));
            }
            pending.put(sourceName, slots);
        }

        Map<String, List<RetrievalResult>> results = new LinkedHashMap<>();
        pending.forEach((sourceName, slots) -> {
            List<RetrievalResult> sourceResults = new ArrayList<>(slots.size());
            for (CompletableFuture<RetrievalResult> slot : slots) {
                sourceResults.add(slot.join());
            }
            results.put(sourceName, sourceResults);
        });

        log.info("[dispatcher] area={} sources={} documents={}", area, results.keySet(), countDocuments(results));
        return results;
    }

    private CompletableFuture<RetrievalResult> dispatch(String query, String area, int limit, String sourceName,
                                                        String retrieverName, Map<String, Object> filters) {
        return retrieverRegistry.get(retrieverName)
                .map(retriever -> CompletableFuture
                        .supplyAsync(() -> retriever.retrieve(query, area, limit, filters), retrievalExecutor)
                        .exceptionally(e -> {
                            Throwable cause = e.getCause() != null ? e.getCause() : e;
                            log.error("[dispatcher] Retriever {} failed for area={} source={}: {}",
                                    retrieverName, area, sourceName, cause.getMessage());
                            return RetrievalResult.failure(retrieverName, sourceName, RetrievalResult.ERROR,
                                    String.valueOf(cause.getMessage()));
                        }))
                .orElseGet(() -> {
                    log.error("[dispatcher] Retriever {} not registered for area={} source={}",
                            retrieverName, area, sourceName);
                    return CompletableFuture.completedFuture(RetrievalResult.failure(
                            retrieverName, sourceName, RetrievalResult.RETRIEVER_NOT_FOUND,
                            "Retriever '" + retrieverName + "' is not registered."));
                });
    }

    private static Set<String> normalized(List<String> sources) {
        Set<String> result = new HashSet<>();
        for (String source : sources) {
            if (source != null) {
                result.add(source.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    public static int countDocuments(Map<String, List<RetrievalResult>> results) {
        return results.values().stream()
                .flatMap(List::stream)
                .mapToInt(result -> result.getDocuments().size())
                .sum();
    }
}
