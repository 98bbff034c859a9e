package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.model.RetrievalUnit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedSource {

    @Builder.Default
    private List<RetrievalUnit> units = new ArrayList<>();

    @Builder.Default
    private List<String> imports = new ArrayList<>();

    @Builder.Default
    private List<String> globalVariables = new ArrayList<>();

    private String syntaxError;

    public static ParsedSource failed(String syntaxError) {
        return ParsedSource.builder().syntaxError(syntaxError).build();
    }

    public static ParsedSource empty() {
        return ParsedSource.builder().build();
    }
}
