package com.architecture.memory.recall.service.store;

import com.architecture.memory.recall.model.SearchHit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Search API ({@code POST /collections/{c}/points/search}) with a named vector, for servers
 * older than 1.10.
 */
public class LegacySearchPointsAdapter implements DenseSearchAdapter {

    @Override
    public String name() {
        return "points/search";
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<SearchHit> search(QdrantRestClient client, String collection, String vectorField,
                                  List<Float> vector, int limit) {
        Map<String, Object> searchRequest = new LinkedHashMap<>();
        searchRequest.put("vector", Map.of("name", vectorField, "vector", vector));
        searchRequest.put("limit", limit);
        searchRequest.put("with_payload", true);

        Map<String, Object> body = client.post("/collections/" + collection + "/points/search", searchRequest);
        if (!(body.get("result") instanceof List)) {
            throw new IndexStoreException("Search response for '" + collection + "' has no 'result' list");
        }
        return ((List<Map<String, Object>>) body.get("result")).stream()
                .map(DenseSearchAdapter::toHit)
                .collect(Collectors.toList());
    }
}
