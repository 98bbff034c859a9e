package com.architecture.memory.recall.dto;

import com.architecture.memory.recall.model.FusedResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer to a question, with the fused code results it was grounded on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {
    private String answer;
    private List<FusedResult> evidence;
    private List<String> recommendations;
    private int memoriesUsed;
    private String memoryId;
    private long processingTimeMs;
}
