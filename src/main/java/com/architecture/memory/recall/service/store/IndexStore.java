package com.architecture.memory.recall.service.store;

import com.architecture.memory.recall.model.IndexRecord;
import com.architecture.memory.recall.model.SearchHit;
import com.architecture.memory.recall.model.UpsertReport;

import java.util.List;

/**
 * Store of (id, dense vector, payload) records partitioned into named collections.
 */
public interface IndexStore extends AutoCloseable {

    /**
     * Creates every configured collection that does not exist yet. Safe to call on every start.
     */
    void ensureCollections();

    /**
     * Writes records with overwrite-by-id semantics, in bounded batches.
     * Partial failure is reported, not thrown.
     */
    UpsertReport upsert(String collection, List<? extends IndexRecord> records);

    /**
     * The {@code limit} records nearest to {@code vector} by cosine similarity, best first.
     */
    List<SearchHit> denseSearch(String collection, List<Float> vector, String vectorField, int limit);

    /**
     * Up to {@code limit} records whose lexical fields contain any of the tokens, in scan order.
     * Hit scores are synthetic ({@code 1 / (1 + position)}) and carry no relevance.
     */
    List<SearchHit> lexicalSearch(String collection, List<String> tokens, int limit);

    long count(String collection);

    List<CollectionSpec> getCollections();

    /**
     * Releases the connection. No-op unless the store holds resources of its own.
     */
    @Override
    default void close() {
    }
}
