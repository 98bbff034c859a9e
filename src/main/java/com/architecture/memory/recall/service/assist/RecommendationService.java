package com.architecture.memory.recall.service.assist;

import com.architecture.memory.recall.model.CodeRecord;
import com.architecture.memory.recall.model.FusedResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Suggests files to look at next: one line per distinct file, best fused score first.
 */
@Service
public class RecommendationService {

    public static final int DEFAULT_LIMIT = 5;

    public List<String> recommend(List<FusedResult> results) {
        return recommend(results, DEFAULT_LIMIT);
    }

    public List<String> recommend(List<FusedResult> results, int limit) {
        List<FusedResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingDouble(FusedResult::getFusedScore).reversed());

        Set<String> seenFiles = new HashSet<>();
        List<String> recommendations = new ArrayList<>();
        for (FusedResult result : ordered) {
            if (recommendations.size() >= limit) {
                break;
            }
            CodeRecord record = result.asCodeRecord();
            if (record.getFile().isEmpty() || !seenFiles.add(record.getFile())) {
                continue;
            }
            recommendations.add(String.format("- Inspect `%s` (related: `%s`)", record.getFile(), record.getName()));
        }
        return recommendations;
    }
}
