package com.architecture.memory.recall.controller;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.dto.AskResponse;
import com.architecture.memory.recall.model.FusedResult;
import com.architecture.memory.recall.service.assist.CodeAssistantService;
import com.architecture.memory.recall.service.retrieval.HybridSearchService;
import com.architecture.memory.recall.service.retrieval.RetrievalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

    @Mock
    private HybridSearchService hybridSearchService;

    @Mock
    private CodeAssistantService assistantService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RetrievalSettings settings = new RetrievalSettings(6, 4, 3, 60, 1800, 9000, 1000);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new SearchController(hybridSearchService, assistantService, settings)).build();
    }

    @Test
    void searchReturnsFusedResultsWithDefaultLimit() throws Exception {
        when(hybridSearchService.search("where is parse_config", 6)).thenReturn(List.of(
                FusedResult.builder().recordId("r1").fusedScore(0.032).payload(Map.of("file", "cfg.py")).build()));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"where is parse_config\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resultCount").value(1))
                .andExpect(jsonPath("$.tokens[1]").value("parse_config"))
                .andExpect(jsonPath("$.results[0].recordId").value("r1"))
                .andExpect(jsonPath("$.results[0].payload.file").value("cfg.py"));
    }

    @Test
    void searchRejectsBlankQuery() throws Exception {
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"  \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(hybridSearchService);
    }

    @Test
    void searchRejectsOutOfRangeLimit() throws Exception {
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"charge\",\"limit\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void searchFailureReturnsServerError() throws Exception {
        when(hybridSearchService.search(anyString(), anyInt()))
                .thenThrow(new RetrievalException("dense search failed: refused", null));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"charge\",\"limit\":3}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Search failed: dense search failed: refused"));
    }

    @Test
    void askReturnsAnswer() throws Exception {
        when(assistantService.ask("how are refunds issued?")).thenReturn(AskResponse.builder()
                .answer("Through RefundService.")
                .evidence(List.of())
                .recommendations(List.of("- Inspect `src/RefundService.java` (related: `issue`)"))
                .memoriesUsed(2)
                .build());

        mockMvc.perform(post("/api/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"how are refunds issued?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Through RefundService."))
                .andExpect(jsonPath("$.memoriesUsed").value(2));
    }
}
