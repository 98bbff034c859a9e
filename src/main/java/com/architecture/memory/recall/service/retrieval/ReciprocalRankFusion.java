package com.architecture.memory.recall.service.retrieval;

import com.architecture.memory.recall.model.FusedResult;
import com.architecture.memory.recall.model.SearchHit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion of ranked lists.
 * <p>
 * A record at 1-based rank {@code r} in a list contributes {@code 1 / (k + r)}; contributions
 * are summed across lists. Only ranks matter, so the lists' raw scores never need to be
 * comparable. Ties keep first-encounter order (lists in argument order), and a record's payload
 * comes from the first list that returned it.
 */
public class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private final int k;

    public ReciprocalRankFusion(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("rrf k must not be negative");
        }
        this.k = k;
    }

    public List<FusedResult> fuse(List<List<SearchHit>> rankedLists, int limit) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Map<String, Object>> payloads = new LinkedHashMap<>();

        for (List<SearchHit> ranked : rankedLists) {
            for (int i = 0; i < ranked.size(); i++) {
                SearchHit hit = ranked.get(i);
                int rank = i + 1;
                scores.merge(hit.getId(), 1.0 / (k + rank), Double::sum);
                if (hit.getPayload() != null) {
                    payloads.putIfAbsent(hit.getId(), hit.getPayload());
                }
            }
        }

        List<FusedResult> fused = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> fused.add(FusedResult.builder()
                .recordId(id)
                .fusedScore(score)
                .payload(payloads.getOrDefault(id, Map.of()))
                .build()));
        // List.sort is stable, which keeps first-encounter order on ties
        fused.sort(Comparator.comparingDouble(FusedResult::getFusedScore).reversed());

        return new ArrayList<>(fused.subList(0, Math.min(Math.max(limit, 0), fused.size())));
    }

    public List<FusedResult> fuse(List<SearchHit> dense, List<SearchHit> keyword, int limit) {
        return fuse(List.of(dense, keyword), limit);
    }
}
