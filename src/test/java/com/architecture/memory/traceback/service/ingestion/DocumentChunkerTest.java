package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.model.Document;
import com.architecture.memory.traceback.model.DocumentType;
import com.architecture.memory.traceback.model.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentChunkerTest {

    private DocumentChunker chunker;

    @BeforeEach
    void setUp() {
        TracebackProperties properties = new TracebackProperties();
        properties.getIngestion().setChunkSize(100);
        properties.getIngestion().setChunkOverlap(10);
        chunker = new DocumentChunker(properties);
    }

    private static Document document(String id, String content) {
        return Document.builder()
                .id(id)
                .content(content)
                .title("Refill policy")
                .source(SourceType.CONFLUENCE)
                .documentType(DocumentType.REQUIREMENT)
                .businessArea("pharmacy")
                .lastModified(Instant.parse("2026-02-01T12:00:00Z"))
                .url("https://wiki/refill")
                .metadata(Map.of("space_key", "PHARM"))
                .build();
    }

    @Test
    void producesSingleChunkWithDocumentFields_forShortContent() {
        List<Map<String, Object>> chunks = chunker.chunk(document("confluence_1", "Refills are allowed after 21 days."));

        assertThat(chunks).singleElement().satisfies(chunk -> assertThat(chunk)
                .containsEntry("id", "confluence_1_chunk_0")
                .containsEntry("parent_document_id", "confluence_1")
                .containsEntry("source", "confluence")
                .containsEntry("document_type", "requirement")
                .containsEntry("business_area", "pharmacy")
                .containsEntry("last_modified", "2026-02-01T12:00:00Z")
                .containsEntry("chunk_index", 0)
                .containsEntry("total_chunks", 1)
                .containsEntry("space_key", "PHARM"));
    }

    @Test
    void splitsLongContent_intoIndexedChunks() {
        String paragraph = "Prescription refills require pharmacist review before release. ";
        List<Map<String, Object>> chunks = chunker.chunk(document("confluence_2", paragraph.repeat(10)));

        assertThat(chunks.size()).isGreaterThan(1);
        for (int i = 0; i < chunks.size(); i++) {
            assertThat(chunks.get(i))
                    .containsEntry("id", DocumentChunker.chunkId("confluence_2", i))
                    .containsEntry("chunk_index", i)
                    .containsEntry("total_chunks", chunks.size());
        }
    }

    @Test
    void skipsBlankDocuments() {
        assertThat(chunker.chunk(document("confluence_3", "   "))).isEmpty();
        assertThat(chunker.chunkAll(List.of(document("confluence_4", null), document("confluence_5", "text")))).hasSize(1);
    }
}
