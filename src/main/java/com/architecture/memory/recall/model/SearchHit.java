package com.architecture.memory.recall.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One record returned by a store query. For lexical hits the score is synthetic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {
    private String id;
    private double score;
    private Map<String, Object> payload;
}
