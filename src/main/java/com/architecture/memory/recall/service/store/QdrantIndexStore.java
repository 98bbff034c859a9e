package com.architecture.memory.recall.service.store;

import com.architecture.memory.recall.model.CodeRecord;
import com.architecture.memory.recall.model.IndexRecord;
import com.architecture.memory.recall.model.SearchHit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * {@link IndexStore} backed by Qdrant over REST.
 * <p>
 * Batch writes are retried with exponential backoff before the batch is reported as failed.
 * Dense search goes through the adapter chosen at startup.
 */
@Slf4j
public class QdrantIndexStore extends AbstractBatchingIndexStore {

    private final QdrantRestClient client;
    private final DenseSearchAdapter denseSearchAdapter;
    private final int maxRetries;
    private final long retryBackoffMs;

    public QdrantIndexStore(QdrantRestClient client,
                            DenseSearchAdapter denseSearchAdapter,
                            List<CollectionSpec> collections,
                            int batchSize,
                            Executor executor,
                            int maxRetries,
                            long retryBackoffMs) {
        super(collections, batchSize, executor);
        this.client = client;
        this.denseSearchAdapter = denseSearchAdapter;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryBackoffMs = retryBackoffMs;
    }

    @Override
    public void ensureCollections() {
        for (CollectionSpec spec : getCollections()) {
            if (client.collectionExists(spec.getName())) {
                log.info("[Qdrant REST] Collection '{}' already exists", spec.getName());
            } else {
                log.info("[Qdrant REST] Creating collection '{}'", spec.getName());
                client.createCollection(spec.getName(), spec.getVectorField(), spec.getDimension());
            }
        }
    }

    @Override
    protected void writeBatch(CollectionSpec spec, List<IndexRecord> batch) {
        List<Map<String, Object>> points = new ArrayList<>(batch.size());
        for (IndexRecord record : batch) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("id", record.getId());
            point.put("vector", Map.of(spec.getVectorField(), record.getVector()));
            point.put("payload", record.toPayload());
            points.add(point);
        }
        upsertWithRetry(spec.getName(), points);
    }

    private void upsertWithRetry(String collection, List<Map<String, Object>> points) {
        int attempt = 0;
        while (true) {
            try {
                client.upsertPoints(collection, points);
                return;
            } catch (IndexStoreException e) {
                attempt++;
                if (attempt >= maxRetries) {
                    throw new IndexStoreException("Upsert of " + points.size() + " points into '" + collection
                            + "' failed after " + attempt + " attempts: " + e.getMessage(), e);
                }
                long waitTime = retryBackoffMs * (1L << (attempt - 1));
                log.warn("[Qdrant REST] Upsert failed (attempt {}/{}), retrying in {}ms: {}",
                        attempt, maxRetries, waitTime, e.getMessage());
                try {
                    Thread.sleep(waitTime);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IndexStoreException("Interrupted during retry", ie);
                }
            }
        }
    }

    @Override
    public List<SearchHit> denseSearch(String collection, List<Float> vector, String vectorField, int limit) {
        spec(collection);
        log.debug("[Qdrant REST] Dense search on '{}' via {}, limit {}", collection, denseSearchAdapter.name(), limit);
        return denseSearchAdapter.search(client, collection, vectorField, vector, limit);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<SearchHit> lexicalSearch(String collection, List<String> tokens, int limit) {
        spec(collection);
        if (tokens.isEmpty()) {
            return List.of();
        }

        List<Map<String, Object>> should = new ArrayList<>();
        for (String token : tokens) {
            for (String field : CodeRecord.LEXICAL_FIELDS) {
                should.add(Map.of("key", field, "match", Map.of("text", token)));
            }
        }

        Map<String, Object> scrollRequest = new LinkedHashMap<>();
        scrollRequest.put("filter", Map.of("should", should));
        scrollRequest.put("limit", limit);
        scrollRequest.put("with_payload", true);
        scrollRequest.put("with_vector", false);

        List<Map<String, Object>> points = client.scroll(collection, scrollRequest);
        List<SearchHit> hits = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            Map<String, Object> point = points.get(i);
            Object payload = point.get("payload");
            hits.add(SearchHit.builder()
                    .id(String.valueOf(point.get("id")))
                    .score(1.0 / (1 + i))
                    .payload(payload instanceof Map ? (Map<String, Object>) payload : Map.of())
                    .build());
        }
        log.debug("[Qdrant REST] Lexical search on '{}' with {} tokens returned {} points",
                collection, tokens.size(), hits.size());
        return hits;
    }

    @Override
    public long count(String collection) {
        spec(collection);
        return client.count(collection);
    }
}
