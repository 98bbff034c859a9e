package com.architecture.memory.recall.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Getter
public class IngestSettings {

    private final int batchSize;
    private final int concurrency;
    private final int maxRetries;
    private final long retryBackoffMs;

    public IngestSettings(@Value("${ingest.batch-size:256}") int batchSize,
                          @Value("${ingest.concurrency:2}") int concurrency,
                          @Value("${ingest.max-retries:3}") int maxRetries,
                          @Value("${ingest.retry-backoff-ms:1000}") long retryBackoffMs) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("ingest.batch-size must be positive");
        }
        this.batchSize = batchSize;
        this.concurrency = Math.max(1, concurrency);
        this.maxRetries = Math.max(1, maxRetries);
        this.retryBackoffMs = retryBackoffMs;
    }
}
