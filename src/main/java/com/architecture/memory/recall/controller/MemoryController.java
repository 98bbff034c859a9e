package com.architecture.memory.recall.controller;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.dto.ErrorResponse;
import com.architecture.memory.recall.dto.MemoryEntryResponse;
import com.architecture.memory.recall.dto.RecallRequest;
import com.architecture.memory.recall.dto.RememberRequest;
import com.architecture.memory.recall.model.MemoryRecord;
import com.architecture.memory.recall.service.memory.ConversationMemoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final ConversationMemoryService memoryService;
    private final RetrievalSettings retrievalSettings;

    @PostMapping
    public ResponseEntity<?> remember(@Valid @RequestBody RememberRequest request) {
        try {
            MemoryRecord record = memoryService.remember(request.getUserText(), request.getAssistantText(),
                    request.getFiles(), request.getTags());
            return ResponseEntity.ok(MemoryEntryResponse.from(record));
        } catch (Exception e) {
            log.error("[Memory Controller] Error storing memory: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.builder()
                    .status("error")
                    .message("Failed to store memory: " + e.getMessage())
                    .build());
        }
    }

    @PostMapping("/recall")
    public ResponseEntity<?> recall(@Valid @RequestBody RecallRequest request) {
        try {
            int limit = request.getLimit() == null ? retrievalSettings.getTopKMemory() : request.getLimit();
            List<MemoryEntryResponse> entries = memoryService.recall(request.getQuery(), limit).stream()
                    .map(MemoryEntryResponse::from)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(entries);
        } catch (Exception e) {
            log.error("[Memory Controller] Error recalling memory: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.builder()
                    .status("error")
                    .message("Failed to recall memory: " + e.getMessage())
                    .build());
        }
    }
}
