package com.architecture.memory.recall.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    @NotBlank
    private String query;

    /**
     * Defaults to {@code max(top-k-dense, top-k-keyword)} when absent.
     */
    @Min(1)
    @Max(100)
    private Integer limit;
}
