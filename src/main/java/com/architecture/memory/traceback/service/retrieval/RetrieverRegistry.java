package com.architecture.memory.traceback.service.retrieval;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Retriever instances keyed by name, built once from the retriever beans in the context.
 */
@Component
@Slf4j
public class RetrieverRegistry {

    private final Map<String, Retriever> retrievers;

    public RetrieverRegistry(List<Retriever> retrievers) {
        Map<String, Retriever> byName = new LinkedHashMap<>();
        for (Retriever retriever : retrievers) {
            Retriever previous = byName.put(retriever.name(), retriever);
            if (previous != null) {
                throw new IllegalStateException("Duplicate retriever name: " + retriever.name());
            }
        }
        this.retrievers = Collections.unmodifiableMap(byName);
        log.info("[retriever-registry] Registered retrievers: {}", this.retrievers.keySet());
    }

    public Optional<Retriever> get(String name) {
        return Optional.ofNullable(retrievers.get(name));
    }

    public Set<String> names() {
        return retrievers.keySet();
    }
}
