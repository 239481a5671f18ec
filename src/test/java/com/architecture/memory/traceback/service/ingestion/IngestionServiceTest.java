package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.dto.ChangeSet;
import com.architecture.memory.traceback.dto.IngestionResult;
import com.architecture.memory.traceback.model.Document;
import com.architecture.memory.traceback.model.DocumentType;
import com.architecture.memory.traceback.model.SourceType;
import com.architecture.memory.traceback.service.search.HybridSearchEngine;
import com.architecture.memory.traceback.service.search.QdrantRestClient;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final String AREA = "pharmacy";
    private static final String SOURCE_ID = "confluence_PH";

    @Mock
    private EmbeddingModel embeddingModel;

    @Mock
    private QdrantRestClient qdrantClient;

    @Mock
    private HybridSearchEngine hybridSearchEngine;

    @Mock
    private ChangeDetector changeDetector;

    @Mock
    private DocumentFetcher fetcher;

    @Mock
    private ObjectProvider<DocumentFetcherFactory> fetcherFactories;

    private IngestionService service(String sourcesConfig, DocumentFetcherFactory... factories) {
        TracebackProperties properties = new TracebackProperties();
        properties.setBusinessAreas(List.of(AREA));
        properties.setSourcesConfig(sourcesConfig);
        when(fetcherFactories.orderedStream()).thenReturn(Stream.of(factories));
        return new IngestionService(new DocumentChunker(properties), embeddingModel, qdrantClient, hybridSearchEngine,
                changeDetector, new SourceConfigResolver(properties), new SourceSettingsTranslator(), fetcherFactories,
                properties, 1536);
    }

    private static Document document(String id, String content) {
        return Document.builder()
                .id(id)
                .content(content)
                .title(id)
                .source(SourceType.CONFLUENCE)
                .documentType(DocumentType.WIKI)
                .businessArea(AREA)
                .build();
    }

    private void embedEverySegment() {
        when(embeddingModel.embedAll(anyList())).thenAnswer(invocation -> {
            List<TextSegment> segments = invocation.getArgument(0);
            return Response.from(segments.stream()
                    .map(segment -> Embedding.from(new float[]{0.1f, 0.2f}))
                    .collect(Collectors.toList()));
        });
    }

    @Test
    void fetchesEverything_onFirstSync() {
        IngestionService service = service("");
        when(fetcher.sourceId()).thenReturn(SOURCE_ID);
        when(changeDetector.getLastSyncTimestamp(AREA, SOURCE_ID)).thenReturn(Optional.empty());
        when(fetcher.fetchAll()).thenReturn(List.of(document("d1", "refill rules"), document("d2", "stock levels")));
        when(fetcher.getAllDocumentIds()).thenReturn(List.of("d1", "d2"));
        when(changeDetector.getStoredDocumentIds(AREA, SOURCE_ID)).thenReturn(Set.of());
        when(changeDetector.detectChanges(AREA, SOURCE_ID, List.of("d1", "d2")))
                .thenReturn(ChangeSet.builder().added(Set.of("d1", "d2")).build());
        embedEverySegment();

        IngestionResult result = service.ingest(AREA, fetcher, SyncMode.INCREMENTAL);

        assertThat(result.getStatus()).isEqualTo("SUCCESS");
        assertThat(result.getDocumentsProcessed()).isEqualTo(2);
        assertThat(result.getChunksCreated()).isEqualTo(2);
        assertThat(result.getDocumentsAdded()).isEqualTo(2);
        verify(fetcher, never()).fetchSince(any());
        verify(qdrantClient).ensureCollection(AREA, 1536);
        verify(qdrantClient, never()).deleteByFilter(anyString(), anyMap());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<QdrantRestClient.EmbeddingPoint>> points = ArgumentCaptor.forClass(List.class);
        verify(qdrantClient).upsert(eq(AREA), points.capture());
        assertThat(points.getValue()).hasSize(2);
        assertThat(points.getValue().get(0).getId()).isEqualTo(QdrantRestClient.pointId("d1_chunk_0"));

        verify(hybridSearchEngine).updateLexicalIndex(eq(AREA), eq(SOURCE_ID), anyList(), eq(Set.of()), eq(true));
        verify(changeDetector).updateSyncMetadata(AREA, SOURCE_ID, List.of("d1", "d2"));
    }

    @Test
    void removesChunksOfUpdatedAndDeletedDocuments_onIncrementalSync() {
        IngestionService service = service("");
        Instant lastSync = Instant.parse("2026-05-01T00:00:00Z");
        when(fetcher.sourceId()).thenReturn(SOURCE_ID);
        when(changeDetector.getLastSyncTimestamp(AREA, SOURCE_ID)).thenReturn(Optional.of(lastSync));
        when(fetcher.fetchSince(lastSync)).thenReturn(List.of(document("d1", "refill rules revised")));
        when(fetcher.getAllDocumentIds()).thenReturn(List.of("d1", "d2"));
        when(changeDetector.getStoredDocumentIds(AREA, SOURCE_ID)).thenReturn(Set.of("d1", "d2", "d3"));
        when(changeDetector.detectChanges(AREA, SOURCE_ID, List.of("d1", "d2")))
                .thenReturn(ChangeSet.builder().deleted(Set.of("d3")).existing(Set.of("d1", "d2")).build());
        embedEverySegment();

        IngestionResult result = service.ingest(AREA, fetcher, SyncMode.INCREMENTAL);

        assertThat(result.getDocumentsDeleted()).isEqualTo(1);
        verify(fetcher, never()).fetchAll();
        verify(qdrantClient).deleteByFilter(AREA, Map.of("parent_document_id", List.of("d1")));
        verify(qdrantClient).deleteByFilter(AREA, Map.of("parent_document_id", List.of("d3")));
        verify(hybridSearchEngine).updateLexicalIndex(eq(AREA), eq(SOURCE_ID), anyList(), eq(Set.of("d1", "d3")), eq(false));
    }

    @Test
    void returnsNoDocuments_withoutTouchingTheIndexes() {
        IngestionService service = service("");
        when(fetcher.sourceId()).thenReturn(SOURCE_ID);
        when(changeDetector.getLastSyncTimestamp(AREA, SOURCE_ID)).thenReturn(Optional.of(Instant.now()));
        when(fetcher.fetchSince(any())).thenReturn(List.of());

        IngestionResult result = service.ingest(AREA, fetcher, SyncMode.INCREMENTAL);

        assertThat(result.getStatus()).isEqualTo("NO_DOCUMENTS");
        verifyNoInteractions(qdrantClient, hybridSearchEngine, embeddingModel);
        verify(changeDetector, never()).updateSyncMetadata(anyString(), anyString(), anyList());
    }

    @Test
    void retriesAFailedEmbeddingBatchOnce() {
        IngestionService service = service("");
        when(fetcher.sourceId()).thenReturn(SOURCE_ID);
        when(changeDetector.getLastSyncTimestamp(AREA, SOURCE_ID)).thenReturn(Optional.empty());
        when(fetcher.fetchAll()).thenReturn(List.of(document("d1", "refill rules")));
        when(fetcher.getAllDocumentIds()).thenReturn(List.of("d1"));
        when(changeDetector.getStoredDocumentIds(AREA, SOURCE_ID)).thenReturn(Set.of());
        when(changeDetector.detectChanges(AREA, SOURCE_ID, List.of("d1"))).thenReturn(ChangeSet.builder().build());
        when(embeddingModel.embedAll(anyList()))
                .thenThrow(new RuntimeException("timeout"))
                .thenReturn(Response.from(List.of(Embedding.from(new float[]{0.3f}))));

        IngestionResult result = service.ingest(AREA, fetcher, SyncMode.FULL);

        assertThat(result.getStatus()).isEqualTo("SUCCESS");
        verify(embeddingModel, times(2)).embedAll(anyList());
    }

    @Test
    void recordsPerSourceFailures_andSkipsSourcesWithoutFetcher() {
        DocumentFetcherFactory confluence = new DocumentFetcherFactory() {
            @Override
            public SourceType sourceType() {
                return SourceType.CONFLUENCE;
            }

            @Override
            public DocumentFetcher create(String businessArea, Map<String, Object> settings) {
                throw new IllegalStateException("confluence credentials missing");
            }
        };
        DocumentFetcherFactory gitlab = new DocumentFetcherFactory() {
            @Override
            public SourceType sourceType() {
                return SourceType.GITLAB;
            }

            @Override
            public DocumentFetcher create(String businessArea, Map<String, Object> settings) {
                assertThat(settings).containsEntry("project_path", "team/app");
                return fetcher;
            }
        };
        IngestionService service = service(
                "pharmacy:confluence(space_key=PH);pharmacy:gitlab(projects=team/app);pharmacy:firestore(collection_name=x);pharmacy:codeql(enabled=true);pharmacy:jira",
                confluence, gitlab);
        when(fetcher.sourceId()).thenReturn("gitlab_team_app");
        when(changeDetector.getLastSyncTimestamp(AREA, "gitlab_team_app")).thenReturn(Optional.empty());
        when(fetcher.fetchAll()).thenReturn(List.of());

        Map<String, IngestionResult> results = service.ingestAllSources(AREA, SyncMode.INCREMENTAL);

        assertThat(results.keySet()).containsExactly("confluence", "gitlab");
        assertThat(results.get("confluence").getStatus()).isEqualTo("FAILED");
        assertThat(results.get("confluence").getErrorMessage()).contains("credentials");
        assertThat(results.get("gitlab").getStatus()).isEqualTo("NO_DOCUMENTS");
    }
}
