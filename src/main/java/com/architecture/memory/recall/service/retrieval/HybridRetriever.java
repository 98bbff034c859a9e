package com.architecture.memory.recall.service.retrieval;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.model.SearchHit;
import com.architecture.memory.recall.service.RetrievalContext;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the dense and keyword legs against the codebase collection in parallel.
 * <p>
 * Both legs share one deadline. A leg that misses it contributes an empty list; a leg that
 * fails otherwise fails the whole retrieval.
 */
@Component
@Slf4j
public class HybridRetriever {

    private final RetrievalContext context;
    private final RetrievalSettings settings;
    private final Executor executor;

    public HybridRetriever(RetrievalContext context,
                           RetrievalSettings settings,
                           @Qualifier("retrievalExecutor") Executor executor) {
        this.context = context;
        this.settings = settings;
        this.executor = executor;
    }

    public RankedLegs retrieve(String query, int limit) {
        long deadline = System.currentTimeMillis() + settings.getLegTimeoutMs();

        CompletableFuture<List<SearchHit>> dense =
                CompletableFuture.supplyAsync(() -> denseLeg(query, limit), executor);
        CompletableFuture<List<SearchHit>> keyword =
                CompletableFuture.supplyAsync(() -> keywordLeg(query, limit), executor);

        List<SearchHit> denseHits = await("dense", dense, deadline);
        List<SearchHit> keywordHits = await("keyword", keyword, deadline);

        log.debug("[Hybrid Search] dense={} keyword={} for query '{}'", denseHits.size(), keywordHits.size(), query);
        return new RankedLegs(denseHits, keywordHits);
    }

    public List<SearchHit> denseLeg(String query, int limit) {
        List<Float> vector = context.getEmbeddingClient().embed(query);
        return context.getIndexStore().denseSearch(
                context.getCodebaseCollection(), vector, context.getVectorField(), limit);
    }

    public List<SearchHit> keywordLeg(String query, int limit) {
        List<String> tokens = QueryTokenizer.tokenize(query);
        if (tokens.isEmpty()) {
            return List.of();
        }
        return context.getIndexStore().lexicalSearch(context.getCodebaseCollection(), tokens, limit);
    }

    private static List<SearchHit> await(String leg, CompletableFuture<List<SearchHit>> future, long deadline) {
        long remaining = Math.max(0, deadline - System.currentTimeMillis());
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Hybrid Search] {} leg timed out, continuing without it", leg);
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Hybrid Search] {} leg failed: {}", leg, cause.getMessage());
            throw new RetrievalException(leg + " search failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalException("Interrupted waiting for the " + leg + " leg", e);
        }
    }

    /**
     * The two independently ranked result lists, best first.
     */
    @Value
    public static class RankedLegs {
        List<SearchHit> dense;
        List<SearchHit> keyword;
    }
}
