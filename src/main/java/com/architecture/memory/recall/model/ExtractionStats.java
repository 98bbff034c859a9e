package com.architecture.memory.recall.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionStats {

    @JsonProperty("num_files")
    private int numFiles;

    @JsonProperty("num_syntax_errors")
    private int numSyntaxErrors;

    @JsonProperty("num_skipped_files")
    private int numSkippedFiles;

    @JsonProperty("num_units")
    private int numUnits;

    @JsonProperty("chunk_lines")
    private int chunkLines;

    @JsonProperty("chunk_overlap")
    private int chunkOverlap;
}
