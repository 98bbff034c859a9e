package com.architecture.memory.recall.controller;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.dto.AskRequest;
import com.architecture.memory.recall.dto.AskResponse;
import com.architecture.memory.recall.dto.ErrorResponse;
import com.architecture.memory.recall.dto.SearchRequest;
import com.architecture.memory.recall.dto.SearchResponse;
import com.architecture.memory.recall.model.FusedResult;
import com.architecture.memory.recall.service.assist.CodeAssistantService;
import com.architecture.memory.recall.service.retrieval.HybridSearchService;
import com.architecture.memory.recall.service.retrieval.QueryTokenizer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Query endpoints: raw hybrid search and grounded answers.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

    private final HybridSearchService hybridSearchService;
    private final CodeAssistantService assistantService;
    private final RetrievalSettings retrievalSettings;

    /**
     * POST /api/search
     *
     * Request body:
     * {
     *   "query": "where is the JWT token validated?",
     *   "limit": 6
     * }
     */
    @PostMapping("/search")
    public ResponseEntity<?> search(@Valid @RequestBody SearchRequest request) {
        log.info("[Search Controller] Search: {}", request.getQuery());

        try {
            long startTime = System.currentTimeMillis();
            int limit = request.getLimit() == null ? retrievalSettings.legLimit() : request.getLimit();
            List<FusedResult> results = hybridSearchService.search(request.getQuery(), limit);

            return ResponseEntity.ok(SearchResponse.builder()
                    .query(request.getQuery())
                    .tokens(QueryTokenizer.tokenize(request.getQuery()))
                    .results(results)
                    .resultCount(results.size())
                    .processingTimeMs(System.currentTimeMillis() - startTime)
                    .build());

        } catch (Exception e) {
            log.error("[Search Controller] Error processing search: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.builder()
                    .status("error")
                    .message("Search failed: " + e.getMessage())
                    .build());
        }
    }

    /**
     * POST /api/ask
     *
     * Request body:
     * {
     *   "question": "How are uploads retried?"
     * }
     */
    @PostMapping("/ask")
    public ResponseEntity<AskResponse> ask(@Valid @RequestBody AskRequest request) {
        try {
            return ResponseEntity.ok(assistantService.ask(request.getQuestion()));

        } catch (Exception e) {
            log.error("[Search Controller] Error answering question: {}", e.getMessage(), e);

            AskResponse errorAnswer = AskResponse.builder()
                    .answer("An error occurred while processing your question: " + e.getMessage())
                    .evidence(List.of())
                    .recommendations(List.of())
                    .build();

            return ResponseEntity.status(500).body(errorAnswer);
        }
    }
}
