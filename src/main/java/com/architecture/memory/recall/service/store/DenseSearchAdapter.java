package com.architecture.memory.recall.service.store;

import com.architecture.memory.recall.model.SearchHit;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One request shape for Qdrant nearest-neighbour search. Chosen once at startup by
 * {@link DenseSearchAdapterSelector}.
 */
public interface DenseSearchAdapter {

    /**
     * Short label used in logs.
     */
    String name();

    List<SearchHit> search(QdrantRestClient client, String collection, String vectorField,
                           List<Float> vector, int limit);

    @SuppressWarnings("unchecked")
    static SearchHit toHit(Map<String, Object> point) {
        Object score = point.get("score");
        Object payload = point.get("payload");
        return SearchHit.builder()
                .id(String.valueOf(point.get("id")))
                .score(score instanceof Number ? ((Number) score).doubleValue() : 0.0)
                .payload(payload instanceof Map ? (Map<String, Object>) payload : Collections.emptyMap())
                .build();
    }
}
