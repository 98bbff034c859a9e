package com.architecture.memory.recall.service;

import com.architecture.memory.recall.service.embed.EmbeddingClient;
import com.architecture.memory.recall.service.store.IndexStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Long-lived handles shared by every retrieval component: the index store connection, the
 * embedding client and the collection layout. Built once at startup, closed once at shutdown.
 */
@Getter
@Slf4j
public class RetrievalContext implements AutoCloseable {

    private final IndexStore indexStore;
    private final EmbeddingClient embeddingClient;
    private final String codebaseCollection;
    private final String memoryCollection;
    private final String vectorField;

    public RetrievalContext(IndexStore indexStore,
                            EmbeddingClient embeddingClient,
                            String codebaseCollection,
                            String memoryCollection,
                            String vectorField) {
        this.indexStore = indexStore;
        this.embeddingClient = embeddingClient;
        this.codebaseCollection = codebaseCollection;
        this.memoryCollection = memoryCollection;
        this.vectorField = vectorField;
    }

    @Override
    public void close() {
        log.info("[Retrieval Context] Closing index store connection");
        indexStore.close();
    }
}
