package com.architecture.memory.recall.dto;

import com.architecture.memory.recall.model.ExtractionError;
import com.architecture.memory.recall.model.ExtractionStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractResponse {
    private String repoRoot;
    private String outputPath;
    private ExtractionStats stats;
    private List<ExtractionError> syntaxErrors;
    private long processingTimeMs;
}
