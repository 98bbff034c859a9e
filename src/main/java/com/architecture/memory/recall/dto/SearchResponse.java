package com.architecture.memory.recall.dto;

import com.architecture.memory.recall.model.FusedResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
    private String query;
    private List<String> tokens;
    private List<FusedResult> results;
    private int resultCount;
    private long processingTimeMs;
}
