package com.architecture.memory.recall.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    /**
     * Extraction artifact to load; the configured {@code extraction.output} when absent.
     */
    private String artifactPath;
}
