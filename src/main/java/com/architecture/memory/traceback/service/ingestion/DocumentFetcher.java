package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.model.Document;

import java.time.Instant;
import java.util.List;

/**
 * Pulls documents from one configured source of one business area.
 */
public interface DocumentFetcher {

    /**
     * Stable identifier of the fetched source, e.g. {@code confluence_PHARM}.
     */
    String sourceId();

    List<Document> fetchAll();

    List<Document> fetchSince(Instant since);

    /**
     * Ids of every document currently present in the source, used to detect deletions.
     */
    List<String> getAllDocumentIds();
}
