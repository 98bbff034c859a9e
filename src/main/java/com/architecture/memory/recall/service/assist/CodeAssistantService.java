package com.architecture.memory.recall.service.assist;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.dto.AskResponse;
import com.architecture.memory.recall.model.FusedResult;
import com.architecture.memory.recall.model.MemoryRecord;
import com.architecture.memory.recall.service.memory.ConversationMemoryService;
import com.architecture.memory.recall.service.retrieval.HybridSearchService;
import com.architecture.memory.recall.service.store.IndexStoreException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Answers questions about the indexed codebase.
 * <ol>
 *   <li>recall related past exchanges</li>
 *   <li>hybrid search over the codebase</li>
 *   <li>ask the chat model, grounded on both</li>
 *   <li>store the exchange back into memory</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeAssistantService {

    static final int MAX_REMEMBERED_ANSWER_CHARS = 1200;
    static final List<String> MEMORY_TAGS = List.of("hybrid-search", "memory", "recommendations");

    private static final String SYSTEM_PROMPT = """
            You are an expert software engineer helping with a codebase.
            You MUST:
            - Answer using ONLY the retrieved context and memory (no web browsing).
            - If context is insufficient, say what is missing and what file you would need.
            """;

    private final HybridSearchService hybridSearchService;
    private final ConversationMemoryService memoryService;
    private final ContextAssembler contextAssembler;
    private final RecommendationService recommendationService;
    private final ChatLanguageModel chatLanguageModel;
    private final RetrievalSettings settings;

    public AskResponse ask(String question) {
        long startTime = System.currentTimeMillis();
        log.info("[Assistant] Question: {}", question);

        List<MemoryRecord> memories = memoryService.recall(question, settings.getTopKMemory());
        List<FusedResult> results = hybridSearchService.search(question, settings.legLimit());
        List<String> recommendations = recommendationService.recommend(results);

        String answer = queryLLM(question,
                contextAssembler.memoryContext(memories),
                contextAssembler.codeContext(results));

        String memoryId = rememberExchange(question, answer, results);

        long duration = System.currentTimeMillis() - startTime;
        log.info("[Assistant] Answered in {}ms ({} results, {} memories)", duration, results.size(), memories.size());

        return AskResponse.builder()
                .answer(answer)
                .evidence(results)
                .recommendations(recommendations)
                .memoriesUsed(memories.size())
                .memoryId(memoryId)
                .processingTimeMs(duration)
                .build();
    }

    private String queryLLM(String question, String memoryContext, String codeContext) {
        try {
            String userPrompt = String.format("""
                    Memory (previous exchanges):
                    %s

                    Retrieved code:
                    %s

                    Question:
                    %s

                    Respond with:
                    1) Answer (clear, actionable)
                    2) Evidence (cite file:line ranges you used)
                    3) Recommendations (next files/functions to inspect)
                    """, memoryContext, codeContext, question);

            List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(userPrompt));
            Response<AiMessage> response = chatLanguageModel.generate(messages);
            String text = response.content().text();
            return text == null ? "" : text.trim();

        } catch (RuntimeException e) {
            log.error("[Assistant] Error querying LLM: {}", e.getMessage(), e);
            return "I encountered an error while generating the answer: " + e.getMessage();
        }
    }

    private String rememberExchange(String question, String answer, List<FusedResult> results) {
        Set<String> files = new LinkedHashSet<>();
        for (FusedResult result : results) {
            String file = result.asCodeRecord().getFile();
            if (!file.isEmpty()) {
                files.add(file);
            }
        }
        try {
            return memoryService.remember(question,
                    ContextAssembler.truncate(answer, MAX_REMEMBERED_ANSWER_CHARS), files, MEMORY_TAGS).getId();
        } catch (IndexStoreException e) {
            log.warn("[Assistant] Exchange not stored in memory: {}", e.getMessage());
            return null;
        }
    }
}
