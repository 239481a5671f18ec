package com.architecture.memory.traceback.service.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Per-area BM25 indexes. A rebuild builds the new index first and swaps it in under the
 * area's write lock, so searches either see the old index or the complete new one.
 *
 * <p>Chunks are remembered per source so that ingesting one source rebuilds the area
 * index without dropping the chunks of its other sources.
 */
@Component
@Slf4j
public class LexicalIndexRegistry {

    private final Map<String, Bm25Index> indexes = new ConcurrentHashMap<>();
    private final Map<String, ReadWriteLock> locks = new ConcurrentHashMap<>();
    private final Map<String, Map<String, List<Map<String, Object>>>> corpora = new ConcurrentHashMap<>();

    public void rebuild(String businessArea, List<Map<String, Object>> chunks) {
        Bm25Index index = Bm25Index.build(chunks);
        ReadWriteLock lock = lockFor(businessArea);
        lock.writeLock().lock();
        try {
            indexes.put(businessArea, index);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[bm25] Rebuilt index for area={} chunks={}", businessArea, index.size());
    }

    /**
     * Merge one ingestion cycle of a source into the area corpus and rebuild the index.
     * On a full sync the source's previous chunks are dropped; otherwise only chunks whose
     * {@code parent_document_id} is in {@code replacedDocumentIds} are.
     */
    public void updateSource(String businessArea, String sourceId, List<Map<String, Object>> chunks,
                             Collection<String> replacedDocumentIds, boolean fullSync) {
        Map<String, List<Map<String, Object>>> corpus = corpora.computeIfAbsent(businessArea, area -> new LinkedHashMap<>());
        List<Map<String, Object>> all = new ArrayList<>();
        synchronized (corpus) {
            List<Map<String, Object>> retained = new ArrayList<>();
            if (!fullSync) {
                for (Map<String, Object> chunk : corpus.getOrDefault(sourceId, List.of())) {
                    Object parent = chunk.get("parent_document_id");
                    if (parent == null || !replacedDocumentIds.contains(parent.toString())) {
                        retained.add(chunk);
                    }
                }
            }
            retained.addAll(chunks);
            corpus.put(sourceId, retained);
            corpus.values().forEach(all::addAll);
            rebuild(businessArea, all);
        }
    }

    /**
     * Runs {@code search} against the area index under its read lock. Empty when the area
     * has no index yet.
     */
    public <T> Optional<T> withIndex(String businessArea, Function<Bm25Index, T> search) {
        ReadWriteLock lock = lockFor(businessArea);
        lock.readLock().lock();
        try {
            Bm25Index index = indexes.get(businessArea);
            return index == null ? Optional.empty() : Optional.ofNullable(search.apply(index));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasIndex(String businessArea) {
        return indexes.containsKey(businessArea);
    }

    public void remove(String businessArea) {
        ReadWriteLock lock = lockFor(businessArea);
        lock.writeLock().lock();
        try {
            indexes.remove(businessArea);
            corpora.remove(businessArea);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ReadWriteLock lockFor(String businessArea) {
        return locks.computeIfAbsent(businessArea, area -> new ReentrantReadWriteLock());
    }
}
