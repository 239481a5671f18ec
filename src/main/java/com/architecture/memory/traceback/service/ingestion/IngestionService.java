package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.config.SourceConfig;
import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.dto.ChangeSet;
import com.architecture.memory.traceback.dto.IngestionResult;
import com.architecture.memory.traceback.model.Document;
import com.architecture.memory.traceback.model.SourceType;
import com.architecture.memory.traceback.service.search.HybridSearchEngine;
import com.architecture.memory.traceback.service.search.QdrantRestClient;
import com.architecture.memory.traceback.service.search.QdrantRestClient.EmbeddingPoint;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetch, chunk, embed and index documents for one source, then reconcile deletions
 * against the ids the source still reports.
 */
@Service
@Slf4j
public class IngestionService {

    private final DocumentChunker documentChunker;
    private final EmbeddingModel embeddingModel;
    private final QdrantRestClient qdrantClient;
    private final HybridSearchEngine hybridSearchEngine;
    private final ChangeDetector changeDetector;
    private final SourceConfigResolver sourceConfigResolver;
    private final SourceSettingsTranslator settingsTranslator;
    private final Map<SourceType, DocumentFetcherFactory> fetcherFactories;
    private final int batchSize;
    private final int vectorSize;

    public IngestionService(DocumentChunker documentChunker,
                            EmbeddingModel embeddingModel,
                            QdrantRestClient qdrantClient,
                            HybridSearchEngine hybridSearchEngine,
                            ChangeDetector changeDetector,
                            SourceConfigResolver sourceConfigResolver,
                            SourceSettingsTranslator settingsTranslator,
                            ObjectProvider<DocumentFetcherFactory> fetcherFactories,
                            TracebackProperties properties,
                            @Value("${qdrant.vector-size:1536}") int vectorSize) {
        this.documentChunker = documentChunker;
        this.embeddingModel = embeddingModel;
        this.qdrantClient = qdrantClient;
        this.hybridSearchEngine = hybridSearchEngine;
        this.changeDetector = changeDetector;
        this.sourceConfigResolver = sourceConfigResolver;
        this.settingsTranslator = settingsTranslator;
        this.fetcherFactories = fetcherFactories.orderedStream()
                .collect(Collectors.toMap(DocumentFetcherFactory::sourceType, f -> f, (a, b) -> a));
        this.batchSize = Math.max(1, properties.getIngestion().getBatchSize());
        this.vectorSize = vectorSize;
    }

    public IngestionResult ingest(String businessArea, DocumentFetcher fetcher, SyncMode mode) {
        long start = System.currentTimeMillis();
        String sourceId = fetcher.sourceId();
        log.info("[ingestion] Starting area={} source={} mode={}", businessArea, sourceId, mode);

        List<Document> documents;
        Optional<Instant> lastSync = changeDetector.getLastSyncTimestamp(businessArea, sourceId);
        boolean fullSync = mode == SyncMode.FULL || lastSync.isEmpty();
        if (fullSync) {
            documents = fetcher.fetchAll();
        } else {
            documents = fetcher.fetchSince(lastSync.get());
        }

        if (documents.isEmpty()) {
            log.info("[ingestion] No new documents for area={} source={}", businessArea, sourceId);
            return IngestionResult.builder()
                    .businessArea(businessArea)
                    .sourceId(sourceId)
                    .status("NO_DOCUMENTS")
                    .durationMs(System.currentTimeMillis() - start)
                    .build();
        }

        List<Map<String, Object>> chunks = documentChunker.chunkAll(documents);
        List<EmbeddingPoint> points = embed(chunks);

        Set<String> storedIds = changeDetector.getStoredDocumentIds(businessArea, sourceId);
        Set<String> refreshedIds = documents.stream().map(Document::getId).collect(Collectors.toCollection(HashSet::new));
        refreshedIds.retainAll(storedIds);

        qdrantClient.ensureCollection(businessArea, vectorSize);
        if (!refreshedIds.isEmpty()) {
            // updated documents may now have fewer chunks than before
            qdrantClient.deleteByFilter(businessArea, Map.of("parent_document_id", new ArrayList<>(refreshedIds)));
        }
        qdrantClient.upsert(businessArea, points);

        List<String> currentIds = fetcher.getAllDocumentIds();
        ChangeSet changes = changeDetector.detectChanges(businessArea, sourceId, currentIds);
        if (!changes.getDeleted().isEmpty()) {
            qdrantClient.deleteByFilter(businessArea, Map.of("parent_document_id", new ArrayList<>(changes.getDeleted())));
            log.info("[ingestion] Removed {} deleted documents from area={} source={}",
                    changes.getDeleted().size(), businessArea, sourceId);
        }

        Set<String> replaced = new HashSet<>(refreshedIds);
        replaced.addAll(changes.getDeleted());
        hybridSearchEngine.updateLexicalIndex(businessArea, sourceId, chunks, replaced, fullSync);

        changeDetector.updateSyncMetadata(businessArea, sourceId, currentIds);

        IngestionResult result = IngestionResult.builder()
                .businessArea(businessArea)
                .sourceId(sourceId)
                .status("SUCCESS")
                .documentsProcessed(documents.size())
                .chunksCreated(chunks.size())
                .documentsAdded(changes.getAdded().size())
                .documentsDeleted(changes.getDeleted().size())
                .durationMs(System.currentTimeMillis() - start)
                .build();
        log.info("[ingestion] Completed area={} source={} documents={} chunks={} deleted={} in {}ms",
                businessArea, sourceId, result.getDocumentsProcessed(), result.getChunksCreated(),
                result.getDocumentsDeleted(), result.getDurationMs());
        return result;
    }

    /**
     * Ingest every declared source of the area that has a fetcher factory. One failing
     * source is reported and does not stop the others.
     */
    public Map<String, IngestionResult> ingestAllSources(String businessArea, SyncMode mode) {
        Map<String, IngestionResult> results = new LinkedHashMap<>();

        for (Map.Entry<String, SourceConfig> entry : sourceConfigResolver.resolveSources(businessArea).entrySet()) {
            String sourceName = entry.getKey();
            SourceType sourceType;
            try {
                sourceType = SourceType.fromValue(sourceName);
            } catch (IllegalArgumentException e) {
                log.warn("[ingestion] Skipping unsupported source {} in area={}", sourceName, businessArea);
                continue;
            }

            Optional<Map<String, Object>> settings = settingsTranslator.translate(businessArea, sourceType, entry.getValue());
            if (settings.isEmpty()) {
                continue;
            }
            DocumentFetcherFactory factory = fetcherFactories.get(sourceType);
            if (factory == null) {
                log.warn("[ingestion] No fetcher available for source {} in area={}", sourceName, businessArea);
                continue;
            }

            try {
                results.put(sourceName, ingest(businessArea, factory.create(businessArea, settings.get()), mode));
            } catch (Exception e) {
                log.error("[ingestion] Source {} failed for area={}: {}", sourceName, businessArea, e.getMessage(), e);
                results.put(sourceName, IngestionResult.builder()
                        .businessArea(businessArea)
                        .status("FAILED")
                        .errorMessage(e.getMessage())
                        .build());
            }
        }
        return results;
    }

    private List<EmbeddingPoint> embed(List<Map<String, Object>> chunks) {
        List<EmbeddingPoint> points = new ArrayList<>(chunks.size());
        int batches = (chunks.size() + batchSize - 1) / batchSize;

        for (int i = 0; i < chunks.size(); i += batchSize) {
            List<Map<String, Object>> batch = chunks.subList(i, Math.min(i + batchSize, chunks.size()));
            List<TextSegment> segments = batch.stream()
                    .map(chunk -> TextSegment.from(String.valueOf(chunk.get("content"))))
                    .collect(Collectors.toList());

            List<Embedding> embeddings = embedBatch(segments, i / batchSize + 1);
            for (int j = 0; j < batch.size(); j++) {
                Map<String, Object> payload = batch.get(j);
                points.add(EmbeddingPoint.builder()
                        .id(QdrantRestClient.pointId(String.valueOf(payload.get("id"))))
                        .vector(embeddings.get(j).vectorAsList())
                        .payload(payload)
                        .build());
            }
            log.debug("[ingestion] Embedded batch {}/{}", i / batchSize + 1, batches);
        }
        return points;
    }

    private List<Embedding> embedBatch(List<TextSegment> segments, int batchNumber) {
        try {
            return embeddingModel.embedAll(segments).content();
        } catch (Exception first) {
            log.warn("[ingestion] Embedding batch {} failed, retrying once: {}", batchNumber, first.getMessage());
            return embeddingModel.embedAll(segments).content();
        }
    }
}
