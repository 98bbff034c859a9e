package com.architecture.memory.recall.config;

import com.architecture.memory.recall.service.RetrievalContext;
import com.architecture.memory.recall.service.embed.EmbeddingClient;
import com.architecture.memory.recall.service.store.CollectionSpec;
import com.architecture.memory.recall.service.store.DenseSearchAdapter;
import com.architecture.memory.recall.service.store.DenseSearchAdapterSelector;
import com.architecture.memory.recall.service.store.InMemoryIndexStore;
import com.architecture.memory.recall.service.store.IndexStore;
import com.architecture.memory.recall.service.store.IndexStoreException;
import com.architecture.memory.recall.service.store.QdrantIndexStore;
import com.architecture.memory.recall.service.store.QdrantRestClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builds the index store connection and the {@link RetrievalContext} shared by all components.
 * <p>
 * {@code index.store=qdrant} talks to Qdrant over REST; {@code index.store=memory} keeps
 * everything in process.
 */
@Configuration
@Slf4j
public class IndexStoreConfig {

    @Value("${index.store:qdrant}")
    private String storeType;

    @Value("${index.vector-field:dense}")
    private String vectorField;

    @Value("${index.collections.codebase:codebase_hybrid_v1}")
    private String codebaseCollection;

    @Value("${index.collections.memory:chat_memory_v1}")
    private String memoryCollection;

    @Value("${index.ensure-on-startup:true}")
    private boolean ensureOnStartup;

    @Value("${qdrant.host:localhost}")
    private String qdrantHost;

    @Value("${qdrant.rest-port:6333}")
    private int qdrantRestPort;

    @Value("${qdrant.api-key:}")
    private String qdrantApiKey;

    @Value("${qdrant.query-api:auto}")
    private String queryApi;

    @Value("${qdrant.timeout-seconds:30}")
    private int timeoutSeconds;

    @Bean(destroyMethod = "close")
    public RetrievalContext retrievalContext(EmbeddingClient embeddingClient,
                                             IngestSettings ingestSettings,
                                             RestTemplateBuilder restTemplateBuilder,
                                             @Qualifier("ingestExecutor") Executor ingestExecutor) {
        List<CollectionSpec> collections = List.of(
                new CollectionSpec(codebaseCollection, vectorField, embeddingClient.getDimension()),
                new CollectionSpec(memoryCollection, vectorField, embeddingClient.getDimension()));

        IndexStore store = createStore(collections, ingestSettings, restTemplateBuilder, ingestExecutor);
        if (ensureOnStartup) {
            try {
                store.ensureCollections();
            } catch (IndexStoreException e) {
                log.error("[Index Config] Could not ensure collections at startup, ingestion will retry: {}",
                        e.getMessage());
            }
        }
        return new RetrievalContext(store, embeddingClient, codebaseCollection, memoryCollection, vectorField);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private IndexStore createStore(List<CollectionSpec> collections,
                                   IngestSettings ingestSettings,
                                   RestTemplateBuilder restTemplateBuilder,
                                   Executor ingestExecutor) {
        if ("memory".equalsIgnoreCase(storeType)) {
            log.info("[Index Config] Using in-memory index store");
            return new InMemoryIndexStore(collections, ingestSettings.getBatchSize(), ingestExecutor);
        }
        if (!"qdrant".equalsIgnoreCase(storeType)) {
            throw new IllegalStateException("index.store must be 'qdrant' or 'memory', was: " + storeType);
        }

        log.info("[Index Config] Using Qdrant REST at {}:{}", qdrantHost, qdrantRestPort);
        QdrantRestClient client = new QdrantRestClient(
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                        .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                        .build(),
                qdrantHost, qdrantRestPort, qdrantApiKey);
        DenseSearchAdapter adapter = DenseSearchAdapterSelector.select(
                DenseSearchAdapterSelector.QueryApiMode.from(queryApi), client);

        return new QdrantIndexStore(client, adapter, collections, ingestSettings.getBatchSize(), ingestExecutor,
                ingestSettings.getMaxRetries(), ingestSettings.getRetryBackoffMs());
    }
}
