package com.architecture.memory.recall.service.store;

import com.architecture.memory.recall.model.CodeRecord;
import com.architecture.memory.recall.model.IndexRecord;
import com.architecture.memory.recall.model.SearchHit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Process-local {@link IndexStore} for local runs and tests.
 * <p>
 * Same contract as the Qdrant store: overwrite by id, cosine similarity for dense search and a
 * case-sensitive substring OR filter, in insertion order, for lexical search.
 */
@Slf4j
public class InMemoryIndexStore extends AbstractBatchingIndexStore {

    private final Map<String, Map<String, StoredPoint>> data = new ConcurrentHashMap<>();

    public InMemoryIndexStore(List<CollectionSpec> collections, int batchSize, Executor executor) {
        super(collections, batchSize, executor);
    }

    @Override
    public void ensureCollections() {
        for (CollectionSpec spec : getCollections()) {
            if (data.putIfAbsent(spec.getName(), new LinkedHashMap<>()) == null) {
                log.info("[In-Memory Store] Collection '{}' created", spec.getName());
            }
        }
    }

    @Override
    protected void writeBatch(CollectionSpec spec, List<IndexRecord> batch) {
        Map<String, StoredPoint> points = points(spec.getName());
        synchronized (points) {
            for (IndexRecord record : batch) {
                points.put(record.getId(), new StoredPoint(record.getId(),
                        List.copyOf(record.getVector()), record.toPayload()));
            }
        }
    }

    @Override
    public List<SearchHit> denseSearch(String collection, List<Float> vector, String vectorField, int limit) {
        spec(collection);
        List<SearchHit> hits = new ArrayList<>();
        for (StoredPoint point : snapshot(collection)) {
            hits.add(SearchHit.builder()
                    .id(point.id)
                    .score(cosine(vector, point.vector))
                    .payload(new LinkedHashMap<>(point.payload))
                    .build());
        }
        hits.sort(Comparator.comparingDouble(SearchHit::getScore).reversed());
        return new ArrayList<>(hits.subList(0, Math.min(limit, hits.size())));
    }

    @Override
    public List<SearchHit> lexicalSearch(String collection, List<String> tokens, int limit) {
        spec(collection);
        if (tokens.isEmpty()) {
            return List.of();
        }
        List<SearchHit> hits = new ArrayList<>();
        for (StoredPoint point : snapshot(collection)) {
            if (hits.size() >= limit) {
                break;
            }
            if (matchesAny(point.payload, tokens)) {
                hits.add(SearchHit.builder()
                        .id(point.id)
                        .score(1.0 / (1 + hits.size()))
                        .payload(new LinkedHashMap<>(point.payload))
                        .build());
            }
        }
        return hits;
    }

    @Override
    public long count(String collection) {
        spec(collection);
        return snapshot(collection).size();
    }

    @Override
    public void close() {
        data.clear();
    }

    private static boolean matchesAny(Map<String, Object> payload, List<String> tokens) {
        for (String field : CodeRecord.LEXICAL_FIELDS) {
            Object value = payload.get(field);
            if (value == null) {
                continue;
            }
            String text = value.toString();
            for (String token : tokens) {
                if (text.contains(token)) {
                    return true;
                }
            }
        }
        return false;
    }

    static double cosine(List<Float> a, List<Float> b) {
        if (a.size() != b.size()) {
            throw new IndexStoreException("Vector dimension " + a.size() + " does not match stored " + b.size());
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private Map<String, StoredPoint> points(String collection) {
        return data.computeIfAbsent(collection, name -> new LinkedHashMap<>());
    }

    private List<StoredPoint> snapshot(String collection) {
        Map<String, StoredPoint> points = points(collection);
        synchronized (points) {
            return new ArrayList<>(points.values());
        }
    }

    private static final class StoredPoint {
        private final String id;
        private final List<Float> vector;
        private final Map<String, Object> payload;

        StoredPoint(String id, List<Float> vector, Map<String, Object> payload) {
            this.id = id;
            this.vector = vector;
            this.payload = payload;
        }
    }
}
