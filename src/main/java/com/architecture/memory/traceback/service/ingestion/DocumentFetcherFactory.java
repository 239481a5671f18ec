package com.architecture.memory.traceback.service.ingestion;

import com.architecture.memory.traceback.model.SourceType;

import java.util.Map;

/**
 * Creates fetchers for one kind of source from translated connector settings.
 * Implementations are contributed as beans by connector modules.
 */
public interface DocumentFetcherFactory {

    SourceType sourceType();

    DocumentFetcher create(String businessArea, Map<String, Object> settings);
}
