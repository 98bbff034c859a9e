package com.architecture.memory.recall.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Query-time knobs, all overridable from the environment.
 */
@Component
@Getter
public class RetrievalSettings {

    private final int topKDense;
    private final int topKKeyword;
    private final int topKMemory;
    private final int rrfK;
    private final int maxCodeCharsPerChunk;
    private final int maxTotalContextChars;
    private final long legTimeoutMs;

    public RetrievalSettings(@Value("${retrieval.top-k-dense:6}") int topKDense,
                             @Value("${retrieval.top-k-keyword:6}") int topKKeyword,
                             @Value("${retrieval.top-k-memory:3}") int topKMemory,
                             @Value("${retrieval.rrf-k:60}") int rrfK,
                             @Value("${retrieval.max-code-chars-per-chunk:1800}") int maxCodeCharsPerChunk,
                             @Value("${retrieval.max-total-context-chars:9000}") int maxTotalContextChars,
                             @Value("${retrieval.leg-timeout-ms:10000}") long legTimeoutMs) {
        this.topKDense = topKDense;
        this.topKKeyword = topKKeyword;
        this.topKMemory = topKMemory;
        this.rrfK = rrfK;
        this.maxCodeCharsPerChunk = maxCodeCharsPerChunk;
        this.maxTotalContextChars = maxTotalContextChars;
        this.legTimeoutMs = legTimeoutMs;
    }

    /**
     * Limit applied to each search leg.
     */
    public int legLimit() {
        return Math.max(topKDense, topKKeyword);
    }
}
