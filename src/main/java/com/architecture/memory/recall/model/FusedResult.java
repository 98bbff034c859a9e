package com.architecture.memory.recall.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Output of reciprocal rank fusion, ordered by {@code fusedScore} descending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FusedResult {
    private String recordId;
    private double fusedScore;
    private Map<String, Object> payload;

    @JsonIgnore
    public CodeRecord asCodeRecord() {
        return CodeRecord.fromPayload(recordId, payload);
    }
}
