package com.architecture.memory.recall.controller;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.model.MemoryRecord;
import com.architecture.memory.recall.service.memory.ConversationMemoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashSet;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MemoryControllerTest {

    @Mock
    private ConversationMemoryService memoryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RetrievalSettings settings = new RetrievalSettings(6, 6, 3, 60, 1800, 9000, 1000);
        mockMvc = MockMvcBuilders.standaloneSetup(new MemoryController(memoryService, settings)).build();
    }

    private static MemoryRecord record() {
        return MemoryRecord.builder()
                .id("m-1")
                .userText("q")
                .assistantText("a")
                .combinedText(MemoryRecord.combine("q", "a"))
                .referencedFiles(new LinkedHashSet<>(List.of("src/A.java")))
                .tags(List.of("manual"))
                .build();
    }

    @Test
    void remembersExchange() throws Exception {
        when(memoryService.remember(eq("q"), eq("a"), anyCollection(), anyList())).thenReturn(record());

        mockMvc.perform(post("/api/memory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userText\":\"q\",\"assistantText\":\"a\",\"files\":[\"src/A.java\"],"
                                + "\"tags\":[\"manual\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("m-1"))
                .andExpect(jsonPath("$.text").value("User: q\nAssistant: a"))
                .andExpect(jsonPath("$.files[0]").value("src/A.java"));
    }

    @Test
    void rememberRequiresUserText() throws Exception {
        mockMvc.perform(post("/api/memory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assistantText\":\"a\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void recallUsesConfiguredLimitByDefault() throws Exception {
        when(memoryService.recall("refunds", 3)).thenReturn(List.of(record()));

        mockMvc.perform(post("/api/memory/recall")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"refunds\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("m-1"))
                .andExpect(jsonPath("$[0].tags[0]").value("manual"));
    }
}
