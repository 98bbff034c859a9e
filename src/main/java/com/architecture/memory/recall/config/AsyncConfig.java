package com.architecture.memory.recall.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the two parallel paths: search legs and batch upserts.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor(@Value("${retrieval.executor-threads:8}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("retrieval-");
        executor.initialize();
        return executor;
    }

    // pool size is the upsert concurrency limit
    @Bean(name = "ingestExecutor")
    public ThreadPoolTaskExecutor ingestExecutor(IngestSettings settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getConcurrency());
        executor.setMaxPoolSize(settings.getConcurrency());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("ingest-");
        executor.initialize();
        return executor;
    }
}
