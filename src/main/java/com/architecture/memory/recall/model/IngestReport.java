package com.architecture.memory.recall.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestReport {
    private String repoRoot;
    private int files;
    private int recordsBuilt;
    private int blankUnitsSkipped;
    private long collectionCount;
    private long durationMs;
    private UpsertReport upsert;
}
