package com.architecture.memory.recall.service.store;

import com.architecture.memory.recall.model.SearchHit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Universal query API ({@code POST /collections/{c}/points/query}), Qdrant 1.10 and later.
 */
public class QueryPointsSearchAdapter implements DenseSearchAdapter {

    @Override
    public String name() {
        return "points/query";
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<SearchHit> search(QdrantRestClient client, String collection, String vectorField,
                                  List<Float> vector, int limit) {
        Map<String, Object> queryRequest = new LinkedHashMap<>();
        queryRequest.put("query", vector);
        queryRequest.put("using", vectorField);
        queryRequest.put("limit", limit);
        queryRequest.put("with_payload", true);

        Map<String, Object> body = client.post("/collections/" + collection + "/points/query", queryRequest);
        Object result = body.get("result");
        if (!(result instanceof Map) || !(((Map<String, Object>) result).get("points") instanceof List)) {
            throw new IndexStoreException("Query response for '" + collection + "' has no 'result.points'");
        }
        List<Map<String, Object>> points = (List<Map<String, Object>>) ((Map<String, Object>) result).get("points");
        return points.stream()
                .map(DenseSearchAdapter::toHit)
                .collect(Collectors.toList());
    }
}
