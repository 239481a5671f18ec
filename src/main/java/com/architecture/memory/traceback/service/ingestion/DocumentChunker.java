package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.config.TracebackProperties;
import com.architecture.memory.traceback.model.Document;
import com.architecture.memory.traceback.model.DocumentType;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits documents into chunk payloads. The payload map is what both Qdrant and the
 * BM25 index store, so its keys double as filter fields.
 */
@Component
@Slf4j
public class DocumentChunker {

    private final DocumentSplitter splitter;

    public DocumentChunker(TracebackProperties properties) {
        TracebackProperties.Ingestion ingestion = properties.getIngestion();
        this.splitter = DocumentSplitters.recursive(ingestion.getChunkSize(), ingestion.getChunkOverlap());
    }

    public static String chunkId(String documentId, int index) {
        return documentId + "_chunk_" + index;
    }

    public List<Map<String, Object>> chunk(Document document) {
        if (document.getContent() == null || document.getContent().isBlank()) {
            log.debug("[chunker] Skipping empty document {}", document.getId());
            return List.of();
        }

        List<TextSegment> segments = splitter.split(dev.langchain4j.data.document.Document.from(document.getContent()));
        List<Map<String, Object>> chunks = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            Map<String, Object> chunk = new HashMap<>();
            if (document.getMetadata() != null) {
                chunk.putAll(document.getMetadata());
            }
            chunk.put("id", chunkId(document.getId(), i));
            chunk.put("content", segments.get(i).text());
            chunk.put("title", document.getTitle());
            chunk.put("source", document.getSource() == null ? null : document.getSource().value());
            chunk.put("document_type", (document.getDocumentType() == null ? DocumentType.OTHER : document.getDocumentType()).value());
            chunk.put("business_area", document.getBusinessArea());
            chunk.put("last_modified", document.getLastModified() == null ? null : document.getLastModified().toString());
            chunk.put("url", document.getUrl());
            chunk.put("chunk_index", i);
            chunk.put("total_chunks", segments.size());
            chunk.put("parent_document_id", document.getId());
            chunks.add(chunk);
        }

        log.debug("[chunker] Document {} produced {} chunks", document.getId(), chunks.size());
        return chunks;
    }

    public List<Map<String, Object>> chunkAll(List<Document> documents) {
        List<Map<String, Object>> chunks = new ArrayList<>();
        for (Document document : documents) {
            chunks.addAll(chunk(document));
        }
        return chunks;
    }
}
