package com.architecture.memory.recall.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either {@code localPath} or {@code repositoryUrl} must be set; a local path wins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractRequest {
    private String localPath;
    private String repositoryUrl;
    private String outputPath;

    public boolean hasSource() {
        return (localPath != null && !localPath.isBlank()) || (repositoryUrl != null && !repositoryUrl.isBlank());
    }
}
