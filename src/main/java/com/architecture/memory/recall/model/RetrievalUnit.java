package com.architecture.memory.recall.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One indexable piece of source content: a declaration found by the syntactic pass
 * or a line window produced by the windowing pass.
 * <p>
 * Line numbers are 1-based and inclusive. Serialized with the field names of the
 * extraction artifact ({@code ast_items} / {@code file_chunks} entries).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrievalUnit {

    @JsonProperty("type")
    UnitType type;

    /**
     * Qualified name, {@code file::symbol} for declarations, {@code file::chunk_start_end} for windows.
     */
    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("start_line")
    int startLine;

    @JsonProperty("end_line")
    int endLine;

    @JsonProperty("docstring")
    String docstring;

    @JsonProperty("code")
    String code;

    @JsonProperty("preceding_comments")
    List<String> precedingComments;

    @JsonProperty("language")
    String language;

    /**
     * Extended and implemented types, only set for {@link UnitType#CLASS} units.
     */
    @JsonProperty("bases")
    List<String> bases;

    public static String qualifiedName(String file, String symbol) {
        return file + "::" + symbol;
    }
}
