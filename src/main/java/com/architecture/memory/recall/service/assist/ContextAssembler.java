package com.architecture.memory.recall.service.assist;

import com.architecture.memory.recall.config.RetrievalSettings;
import com.architecture.memory.recall.model.CodeRecord;
import com.architecture.memory.recall.model.FusedResult;
import com.architecture.memory.recall.model.MemoryRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders fused results and recalled memory as prompt context, within the configured caps.
 */
@Component
@RequiredArgsConstructor
public class ContextAssembler {

    static final int MAX_MEMORY_CHARS = 800;

    private final RetrievalSettings settings;

    /**
     * One {@code [file:start-end]  name} block per result with its fenced code truncated to the
     * per-chunk cap. Stops at the first block that would exceed the total cap.
     */
    public String codeContext(List<FusedResult> results) {
        List<String> parts = new ArrayList<>();
        int total = 0;
        for (FusedResult result : results) {
            CodeRecord record = result.asCodeRecord();
            String file = record.getFile().isEmpty() ? "unknown" : record.getFile();
            String name = record.getName().isEmpty() ? "unknown" : record.getName();
            String language = record.getLanguage().isEmpty() ? "text" : record.getLanguage();
            String block = String.format("[%s:%d-%d]  %s\n```%s\n%s\n```",
                    file, record.getStartLine(), record.getEndLine(), name, language,
                    truncate(record.getCode(), settings.getMaxCodeCharsPerChunk()));
            if (total + block.length() > settings.getMaxTotalContextChars()) {
                break;
            }
            parts.add(block);
            total += block.length();
        }
        return String.join("\n\n", parts);
    }

    public String memoryContext(List<MemoryRecord> memories) {
        return memories.stream()
                .map(memory -> "- " + truncate(memory.getCombinedText(), MAX_MEMORY_CHARS))
                .collect(Collectors.joining("\n"));
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
