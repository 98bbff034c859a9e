package com.architecture.memory.recall.controller;

import com.architecture.memory.recall.config.ExtractionSettings;
import com.architecture.memory.recall.dto.ErrorResponse;
import com.architecture.memory.recall.dto.ExtractRequest;
import com.architecture.memory.recall.dto.ExtractResponse;
import com.architecture.memory.recall.dto.IngestRequest;
import com.architecture.memory.recall.model.ExtractionArtifact;
import com.architecture.memory.recall.model.IngestReport;
import com.architecture.memory.recall.service.extract.ExtractionException;
import com.architecture.memory.recall.service.extract.RepositoryExtractionService;
import com.architecture.memory.recall.service.ingest.CodebaseIngestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Paths;

/**
 * Indexing endpoints: extract a repository into the artifact, then ingest the artifact.
 */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {

    private final RepositoryExtractionService extractionService;
    private final CodebaseIngestService ingestService;
    private final ExtractionSettings extractionSettings;

    /**
     * POST /api/index/extract
     *
     * Request body:
     * {
     *   "localPath": "/work/my-repo",
     *   "repositoryUrl": "https://github.com/org/repo.git",
     *   "outputPath": "parsed_code.json"
     * }
     */
    @PostMapping("/extract")
    public ResponseEntity<?> extract(@RequestBody ExtractRequest request) {
        if (!request.hasSource()) {
            return ResponseEntity.badRequest().body(ErrorResponse.builder()
                    .status("error")
                    .message("localPath or repositoryUrl is required")
                    .build());
        }
        log.info("[Index Controller] Extract {}", request.getLocalPath() != null ? request.getLocalPath()
                : request.getRepositoryUrl());

        try {
            long startTime = System.currentTimeMillis();
            String output = request.getOutputPath() == null || request.getOutputPath().isBlank()
                    ? extractionSettings.getOutput() : request.getOutputPath();
            ExtractionArtifact artifact = extractionService.extractAndWrite(
                    request.getLocalPath(), request.getRepositoryUrl(), output);

            return ResponseEntity.ok(ExtractResponse.builder()
                    .repoRoot(artifact.getRepoRoot())
                    .outputPath(output)
                    .stats(artifact.getStats())
                    .syntaxErrors(artifact.getSyntaxErrors())
                    .processingTimeMs(System.currentTimeMillis() - startTime)
                    .build());

        } catch (ExtractionException e) {
            log.error("[Index Controller] Extraction failed: {}", e.getMessage(), e);
            return ResponseEntity.badRequest().body(error("Extraction failed: " + e.getMessage()));
        } catch (Exception e) {
            log.error("[Index Controller] Error extracting repository: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(error("Extraction failed: " + e.getMessage()));
        }
    }

    /**
     * POST /api/index/ingest
     *
     * Request body (optional):
     * {
     *   "artifactPath": "parsed_code.json"
     * }
     */
    @PostMapping("/ingest")
    public ResponseEntity<?> ingest(@RequestBody(required = false) IngestRequest request) {
        String artifactPath = request == null || request.getArtifactPath() == null || request.getArtifactPath().isBlank()
                ? extractionSettings.getOutput() : request.getArtifactPath();
        log.info("[Index Controller] Ingest {}", artifactPath);

        try {
            IngestReport report = ingestService.ingest(Paths.get(artifactPath));
            return ResponseEntity.ok(report);

        } catch (ExtractionException e) {
            log.error("[Index Controller] Cannot load artifact: {}", e.getMessage());
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (Exception e) {
            log.error("[Index Controller] Error ingesting artifact: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(error("Ingestion failed: " + e.getMessage()));
        }
    }

    private static ErrorResponse error(String message) {
        return ErrorResponse.builder()
                .status("error")
                .message(message)
                .build();
    }
}
