package com.architecture.memory.traceback.service.search;

import com.architecture.memory.traceback.exception.ExternalServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST-based Qdrant client. Every business area owns one collection named
 * {@code {area}_knowledge} with cosine distance and keyword indexes on the
 * fields retrievers filter by.
 */
@Service
@Slf4j
public class QdrantRestClient {

    static final List<String> INDEXED_FIELDS = List.of("source", "document_type", "business_area", "parent_document_id");

    private final RestTemplate restTemplate;
    private final String host;
    private final int restPort;
    private final String apiKey;

    public QdrantRestClient(@Value("${qdrant.host}") String host,
                            @Value("${qdrant.rest-port:6333}") int restPort,
                            @Value("${qdrant.api-key:}") String apiKey) {
        this(new RestTemplate(), host, restPort, apiKey);
    }

    QdrantRestClient(RestTemplate restTemplate, String host, int restPort, String apiKey) {
        this.restTemplate = restTemplate;
        this.host = host;
        this.restPort = restPort;
        this.apiKey = apiKey;
    }

    public static String collectionName(String businessArea) {
        return businessArea + "_knowledge";
    }

    /**
     * Qdrant only accepts unsigned integers or UUIDs as point ids, so chunk ids are mapped
     * to name-based UUIDs. The original chunk id travels in the payload.
     */
    public static String pointId(String chunkId) {
        return UUID.nameUUIDFromBytes(chunkId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Create the area collection and its payload indexes if missing.
     */
    public void ensureCollection(String businessArea, int vectorSize) {
        String collection = collectionName(businessArea);
        String url = collectionUrl(collection);

        try {
            restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            log.debug("[Qdrant REST] Collection '{}' already exists", collection);
            return;
        } catch (HttpClientErrorException.NotFound e) {
            log.info("[Qdrant REST] Creating collection '{}' (size={})", collection, vectorSize);
        } catch (Exception e) {
            throw new ExternalServiceUnavailableException("qdrant", e.getMessage(), e);
        }

        try {
            Map<String, Object> createRequest = Map.of(
                "vectors", Map.of(
                    "size", vectorSize,
                    "distance", "Cosine"
                )
            );
            restTemplate.exchange(url, HttpMethod.PUT, new HttpEntity<>(createRequest, headers()), String.class);

            for (String field : INDEXED_FIELDS) {
                Map<String, Object> indexRequest = Map.of("field_name", field, "field_schema", "keyword");
                restTemplate.exchange(url + "/index", HttpMethod.PUT, new HttpEntity<>(indexRequest, headers()), String.class);
            }
            log.info("[Qdrant REST] Collection '{}' created with payload indexes {}", collection, INDEXED_FIELDS);
        } catch (Exception e) {
            log.error("[Qdrant REST] Failed to create collection '{}': {}", collection, e.getMessage(), e);
            throw new ExternalServiceUnavailableException("qdrant", "Failed to create collection " + collection, e);
        }
    }

    public void upsert(String businessArea, List<EmbeddingPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        String url = collectionUrl(collectionName(businessArea)) + "/points?wait=true";

        try {
            Map<String, Object> upsertRequest = Map.of("points", points);
            ResponseEntity<String> response = restTemplate.exchange(
                url,
                HttpMethod.PUT,
                new HttpEntity<>(upsertRequest, headers()),
                String.class
            );

            if (response.getStatusCode().is2xxSuccessful()) {
                log.debug("[Qdrant REST] Upserted {} points into {}", points.size(), collectionName(businessArea));
            } else {
                log.warn("[Qdrant REST] Unexpected upsert response: {}", response.getStatusCode());
            }
        } catch (Exception e) {
            log.error("[Qdrant REST] Failed to upsert points: {}", e.getMessage(), e);
            throw new ExternalServiceUnavailableException("qdrant", "Failed to upsert points: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public List<SearchResult> search(String businessArea, List<Float> queryVector, int limit, Map<String, Object> filters) {
        String collection = collectionName(businessArea);
        String url = collectionUrl(collection) + "/points/search";

        Map<String, Object> searchRequest = new HashMap<>();
        searchRequest.put("vector", queryVector);
        searchRequest.put("limit", limit);
        searchRequest.put("with_payload", true);

        Map<String, Object> filter = buildFilter(filters);
        if (filter != null) {
            searchRequest.put("filter", filter);
        }

        log.debug("[Qdrant REST] Searching collection: {}, limit: {}, filter: {}", collection, limit, filter);

        try {
            ResponseEntity<Map> response = restTemplate.exchange(
                url, HttpMethod.POST, new HttpEntity<>(searchRequest, headers()), Map.class);

            if (response.getBody() != null && response.getBody().containsKey("result")) {
                List<Map<String, Object>> results = (List<Map<String, Object>>) response.getBody().get("result");
                log.debug("[Qdrant REST] Search returned {} results", results.size());
                return results.stream()
                    .map(this::mapToSearchResult)
                    .collect(Collectors.toList());
            }

            log.warn("[Qdrant REST] Search response body is empty or missing 'result' key");
            return Collections.emptyList();
        } catch (HttpClientErrorException.NotFound e) {
            // area never ingested
            log.info("[Qdrant REST] Collection {} does not exist yet, no results", collection);
            return Collections.emptyList();
        } catch (Exception e) {
            log.error("[Qdrant REST] Search in {} failed: {}", collection, e.getMessage());
            throw new ExternalServiceUnavailableException("qdrant", "Search failed: " + e.getMessage(), e);
        }
    }

    /**
     * Delete every point of the area matching the given payload filter.
     */
    public void deleteByFilter(String businessArea, Map<String, Object> filters) {
        Map<String, Object> filter = buildFilter(filters);
        if (filter == null) {
            throw new IllegalArgumentException("Refusing to delete without a filter");
        }
        String url = collectionUrl(collectionName(businessArea)) + "/points/delete?wait=true";

        try {
            restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(Map.of("filter", filter), headers()), String.class);
            log.debug("[Qdrant REST] Deleted points from {} matching {}", collectionName(businessArea), filters);
        } catch (Exception e) {
            log.error("[Qdrant REST] Delete failed: {}", e.getMessage());
            throw new ExternalServiceUnavailableException("qdrant", "Delete failed: " + e.getMessage(), e);
        }
    }

    /**
     * Translate simple equality filters into a Qdrant {@code must} filter. Collection
     * values match any element, scalars match exactly. Returns null for no filters.
     */
    static Map<String, Object> buildFilter(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return null;
        }

        List<Map<String, Object>> conditions = new ArrayList<>();
        filters.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            Map<String, Object> match = value instanceof Collection<?> values
                    ? Map.of("any", new ArrayList<>(values))
                    : Map.of("value", value);
            conditions.add(Map.of("key", key, "match", match));
        });

        return conditions.isEmpty() ? null : Map.of("must", conditions);
    }

    @SuppressWarnings("unchecked")
    private SearchResult mapToSearchResult(Map<String, Object> result) {
        Object payload = result.get("payload");
        return SearchResult.builder()
            .id(String.valueOf(result.get("id")))
            .score(((Number) result.get("score")).doubleValue())
            .payload(payload == null ? new HashMap<>() : (Map<String, Object>) payload)
            .build();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("api-key", apiKey);
        }
        return headers;
    }

    private String baseUrl() {
        return String.format("http://%s:%d", host, restPort);
    }

    private String collectionUrl(String collection) {
        return baseUrl() + "/collections/" + collection;
    }

    @lombok.Data
    @lombok.Builder
    public static class EmbeddingPoint {
        private String id;
        private List<Float> vector;
        private Map<String, Object> payload;
    }

    @lombok.Data
    @lombok.Builder
    public static class SearchResult {
        private String id;
        private double score;
        private Map<String, Object> payload;
    }
}
