package com.architecture.memory.recall.dto;

import com.architecture.memory.recall.model.MemoryRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEntryResponse {
    private String id;
    private String userText;
    private String assistantText;
    private String text;
    private List<String> files;
    private List<String> tags;
    private Instant createdAt;

    public static MemoryEntryResponse from(MemoryRecord record) {
        return MemoryEntryResponse.builder()
                .id(record.getId())
                .userText(record.getUserText())
                .assistantText(record.getAssistantText())
                .text(record.getCombinedText())
                .files(new ArrayList<>(record.getReferencedFiles()))
                .tags(record.getTags())
                .createdAt(record.getCreatedAt())
                .build();
    }
}
