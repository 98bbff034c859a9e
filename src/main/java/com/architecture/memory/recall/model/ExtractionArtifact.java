package com.architecture.memory.recall.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-off document between extraction and ingestion. The JSON field names are a stable
 * contract: the two stages may run as separate processes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionArtifact {

    @JsonProperty("repo_root")
    private String repoRoot;

    @Builder.Default
    @JsonProperty("readme")
    private String readme = "";

    /**
     * Relative, forward-slash file path to its extraction, in walk order.
     */
    @Builder.Default
    @JsonProperty("parsed_code")
    private Map<String, FileExtraction> parsedCode = new LinkedHashMap<>();

    @JsonProperty("stats")
    private ExtractionStats stats;

    @Builder.Default
    @JsonProperty("syntax_errors")
    private List<ExtractionError> syntaxErrors = new ArrayList<>();
}
