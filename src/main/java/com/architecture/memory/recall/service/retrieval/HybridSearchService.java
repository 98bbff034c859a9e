package com.architecture.memory.recall.service.retrieval;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.model.FusedResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hybrid code search: dense and keyword legs fused by reciprocal rank.
 */
@Service
@Slf4j
public class HybridSearchService {

    private final HybridRetriever retriever;
    private final RetrievalSettings settings;
    private final ReciprocalRankFusion fusion;

    @Autowired
    public HybridSearchService(HybridRetriever retriever, RetrievalSettings settings) {
        this(retriever, settings, new ReciprocalRankFusion(settings.getRrfK()));
    }

    HybridSearchService(HybridRetriever retriever, RetrievalSettings settings, ReciprocalRankFusion fusion) {
        this.retriever = retriever;
        this.settings = settings;
        this.fusion = fusion;
    }

    /**
     * Searches with the configured leg limit, {@code max(top-k-dense, top-k-keyword)}.
     */
    public List<FusedResult> search(String query) {
        return search(query, settings.legLimit());
    }

    public List<FusedResult> search(String query, int limit) {
        long startTime = System.currentTimeMillis();
        HybridRetriever.RankedLegs legs = retriever.retrieve(query, limit);
        List<FusedResult> fused = fusion.fuse(legs.getDense(), legs.getKeyword(), limit);
        log.info("[Hybrid Search] {} results (dense {}, keyword {}) in {}ms",
                fused.size(), legs.getDense().size(), legs.getKeyword().size(),
                System.currentTimeMillis() - startTime);
        return fused;
    }
}
