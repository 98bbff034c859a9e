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
public class RecallRequest {

    @NotBlank
    private String query;

    /**
     * Defaults to {@code top-k-memory} when absent.
     */
    @Min(1)
    @Max(100)
    private Integer limit;
}
