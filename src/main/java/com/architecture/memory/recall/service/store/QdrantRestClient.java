package com.architecture.memory.recall.service.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Thin client for the Qdrant HTTP REST API (port 6333).
 * Request and response bodies are plain maps; every failure surfaces as {@link IndexStoreException}.
 */
@Slf4j
public class QdrantRestClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public QdrantRestClient(RestTemplate restTemplate, String host, int restPort, String apiKey) {
        this.restTemplate = restTemplate;
        this.baseUrl = String.format("http://%s:%d", host, restPort);
        this.apiKey = apiKey;
    }

    /**
     * Server version reported by {@code GET /}, or {@code null} when the server does not say.
     */
    public String getServerVersion() {
        Map<String, Object> body = exchange(HttpMethod.GET, "/", null);
        Object version = body.get("version");
        return version == null ? null : version.toString();
    }

    public boolean collectionExists(String collection) {
        try {
            restTemplate.exchange(baseUrl + "/collections/" + collection, HttpMethod.GET,
                    new HttpEntity<>(headers()), String.class);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (RestClientException e) {
            throw new IndexStoreException("Failed to check collection '" + collection + "': " + e.getMessage(), e);
        }
    }

    public void createCollection(String collection, String vectorField, int dimension) {
        Map<String, Object> createRequest = Map.of(
                "vectors", Map.of(
                        vectorField, Map.of(
                                "size", dimension,
                                "distance", "Cosine"
                        )
                )
        );
        exchange(HttpMethod.PUT, "/collections/" + collection, createRequest);
        log.info("[Qdrant REST] Collection '{}' created ({} dims, vector '{}')", collection, dimension, vectorField);
    }

    /**
     * Upserts points and waits until they are applied, so a following read sees them.
     */
    public void upsertPoints(String collection, List<Map<String, Object>> points) {
        exchange(HttpMethod.PUT, "/collections/" + collection + "/points?wait=true", Map.of("points", points));
        log.debug("[Qdrant REST] Upserted {} points into '{}'", points.size(), collection);
    }

    /**
     * One page of a filtered scroll, in the store's scan order.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> scroll(String collection, Map<String, Object> scrollRequest) {
        Map<String, Object> body = post("/collections/" + collection + "/points/scroll", scrollRequest);
        Object result = body.get("result");
        if (result instanceof Map && ((Map<String, Object>) result).get("points") instanceof List) {
            return (List<Map<String, Object>>) ((Map<String, Object>) result).get("points");
        }
        log.warn("[Qdrant REST] Scroll response for '{}' has no 'result.points'", collection);
        return Collections.emptyList();
    }

    @SuppressWarnings("unchecked")
    public long count(String collection) {
        Map<String, Object> body = post("/collections/" + collection + "/points/count", Map.of("exact", true));
        Object result = body.get("result");
        if (result instanceof Map && ((Map<String, Object>) result).get("count") instanceof Number) {
            return ((Number) ((Map<String, Object>) result).get("count")).longValue();
        }
        throw new IndexStoreException("Count response for '" + collection + "' has no 'result.count'");
    }

    public Map<String, Object> post(String path, Map<String, Object> requestBody) {
        return exchange(HttpMethod.POST, path, requestBody);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> exchange(HttpMethod method, String path, Map<String, Object> requestBody) {
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(requestBody, headers());
        try {
            ResponseEntity<Map> response = restTemplate.exchange(baseUrl + path, method, entity, Map.class);
            return response.getBody() == null ? Collections.emptyMap() : (Map<String, Object>) response.getBody();
        } catch (RestClientException e) {
            log.error("[Qdrant REST] {} {} failed: {}", method, path, e.getMessage());
            throw new IndexStoreException(method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("api-key", apiKey);
        }
        return headers;
    }
}
