package com.architecture.memory.recall.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batched upsert. Rejected records never reached the store; a failed batch
 * was rejected by the store as a whole.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertReport {

    private String collection;
    private int totalRecords;
    private int upsertedRecords;
    private int batchCount;

    @Builder.Default
    private List<BatchFailure> failedBatches = new ArrayList<>();

    @Builder.Default
    private List<RejectedRecord> rejectedRecords = new ArrayList<>();

    public boolean isSuccessful() {
        return failedBatches.isEmpty() && rejectedRecords.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchFailure {
        private int batchIndex;
        private int size;
        private String message;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectedRecord {
        private String id;
        private String reason;
    }
}
