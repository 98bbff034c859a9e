package com.architecture.memory.recall.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Extraction result for one source file, as stored under {@code parsed_code} in the artifact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileExtraction {

    public static final String SKIPPED_PREFIX = "SKIPPED: ";

    @Builder.Default
    @JsonProperty("ast_items")
    private List<RetrievalUnit> astItems = new ArrayList<>();

    @Builder.Default
    @JsonProperty("file_chunks")
    private List<RetrievalUnit> fileChunks = new ArrayList<>();

    @Builder.Default
    @JsonProperty("imports")
    private List<String> imports = new ArrayList<>();

    @Builder.Default
    @JsonProperty("global_variables")
    private List<String> globalVariables = new ArrayList<>();

    /**
     * Parse error message, or a {@code SKIPPED: } reason when the file was not read at all.
     */
    @JsonProperty("syntax_error")
    private String syntaxError;

    public static FileExtraction skipped(String reason) {
        return FileExtraction.builder()
                .syntaxError(SKIPPED_PREFIX + reason)
                .build();
    }

    @JsonIgnore
    public boolean isSkipped() {
        return syntaxError != null && syntaxError.startsWith(SKIPPED_PREFIX);
    }

    @JsonIgnore
    public boolean hasParseError() {
        return syntaxError != null && !isSkipped();
    }

    /**
     * Declarations first, then line windows.
     */
    @JsonIgnore
    public List<RetrievalUnit> allUnits() {
        List<RetrievalUnit> all = new ArrayList<>(astItems.size() + fileChunks.size());
        all.addAll(astItems);
        all.addAll(fileChunks);
        return all;
    }
}
