package com.architecture.memory.traceback.service.retrieval;

import com.architecture.memory.traceback.dto.RetrievalResult;

import java.util.Map;

/**
 * A named strategy that turns a query into documents for one business area.
 * Implementations report failures through {@link RetrievalResult#getError()}.
 */
public interface Retriever {

    String name();

    RetrievalResult retrieve(String query, String businessArea, int limit, Map<String, Object> filters);
}
