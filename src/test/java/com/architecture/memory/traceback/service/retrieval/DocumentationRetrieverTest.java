package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.dto.RankedResult;
import com.architecture.memory.traceback.dto.RetrievalResult;
import com.architecture.memory.traceback.dto.RetrievedDocument;
import com.architecture.memory.traceback.exception.ExternalServiceUnavailableException;
import com.architecture.memory.traceback.service.search.HybridSearchEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentationRetrieverTest {

    @Mock
    private HybridSearchEngine hybridSearchEngine;

    @InjectMocks
    private DocumentationRetriever retriever;

    @Test
    void mapsPayloadFieldsToDocument_andKeepsTheRestAsMetadata() {
        Map<String, Object> payload = Map.of(
                "id", "conf-1_chunk_0",
                "title", "Refill policy",
                "content", "Refills are allowed after 21 days",
                "source", "confluence",
                "document_type", "requirement",
                "url", "https://wiki/refill",
                "space_key", "PHARM");
        when(hybridSearchEngine.hybridSearch(eq("pharmacy"), eq("refill"), eq(5), anyMap()))
                .thenReturn(List.of(RankedResult.builder().id("conf-1_chunk_0").score(0.03).payload(payload).build()));

        RetrievalResult result = retriever.retrieve("refill", "pharmacy", 5, Map.of("source", "confluence"));

        assertThat(result.getMessage()).isEqualTo(RetrievalResult.SUCCESS);
        assertThat(result.getSource()).isEqualTo("confluence");
        RetrievedDocument document = result.getDocuments().get(0);
        assertThat(document.getTitle()).isEqualTo("Refill policy");
        assertThat(document.getDocumentType()).isEqualTo("requirement");
        assertThat(document.getScore()).isEqualTo(0.03);
        assertThat(document.getMetadata()).containsEntry("space_key", "PHARM").containsEntry("id", "conf-1_chunk_0")
                .doesNotContainKeys("title", "content", "source", "document_type", "url");
    }

    @Test
    void reportsNoResults_whenSearchIsEmpty() {
        when(hybridSearchEngine.hybridSearch(eq("pharmacy"), eq("nothing"), eq(3), anyMap())).thenReturn(List.of());

        RetrievalResult result = retriever.retrieve("nothing", "pharmacy", 3, null);

        assertThat(result.getDocuments()).isEmpty();
        assertThat(result.getMessage()).isEqualTo(RetrievalResult.NO_RESULTS);
        assertThat(result.getSource()).isEqualTo("all");
        assertThat(result.isFailed()).isFalse();
    }

    @Test
    void encodesSearchFailureInResult() {
        when(hybridSearchEngine.hybridSearch(eq("pharmacy"), eq("refill"), eq(5), anyMap()))
                .thenThrow(new ExternalServiceUnavailableException("qdrant", "connection refused", null));

        RetrievalResult result = retriever.retrieve("refill", "pharmacy", 5, Map.of("source", "confluence"));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).isEqualTo(RetrievalResult.ERROR);
        assertThat(result.getError()).contains("connection refused");
        assertThat(result.getDocuments()).isEmpty();
    }
}
