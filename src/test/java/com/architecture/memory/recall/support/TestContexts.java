package com.architecture.memory.recall.support;

import com.architecture.memory.recall.service.RetrievalContext;
import com.architecture.memory.recall.service.embed.EmbeddingClient;
import com.architecture.memory.recall.service.store.CollectionSpec;
import com.architecture.memory.recall.service.store.InMemoryIndexStore;

import java.util.List;

public final class TestContexts {

    public static final int DIMENSION = 64;
    public static final String CODEBASE = "codebase_test";
    public static final String MEMORY = "memory_test";
    public static final String VECTOR_FIELD = "dense";

    private TestContexts() {
    }

    public static EmbeddingClient embeddingClient() {
        return new EmbeddingClient(new HashingEmbeddingModel(DIMENSION), DIMENSION);
    }

    public static List<CollectionSpec> collections() {
        return List.of(
                new CollectionSpec(CODEBASE, VECTOR_FIELD, DIMENSION),
                new CollectionSpec(MEMORY, VECTOR_FIELD, DIMENSION));
    }

    /**
     * In-memory store writing batches on the calling thread.
     */
    public static RetrievalContext inMemory(int batchSize) {
        InMemoryIndexStore store = new InMemoryIndexStore(collections(), batchSize, Runnable::run);
        store.ensureCollections();
        return new RetrievalContext(store, embeddingClient(), CODEBASE, MEMORY, VECTOR_FIELD);
    }
}
