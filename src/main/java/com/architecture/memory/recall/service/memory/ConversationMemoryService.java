package com.architecture.memory.recall.service.memory;

import com.architecture.memory.recall.model.MemoryRecord;
import com.architecture.memory.recall.model.SearchHit;
import com.architecture.memory.recall.model.UpsertReport;
import com.architecture.memory.recall.service.RetrievalContext;
import com.architecture.memory.recall.service.store.IndexStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Long-term memory of past exchanges, kept in the memory collection.
 * Dense retrieval only; repeated identical exchanges are stored again under fresh ids.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationMemoryService {

    private final RetrievalContext context;
    private final Clock clock;

    public MemoryRecord remember(String userText, String assistantText,
                                 Collection<String> files, List<String> tags) {
        String combined = MemoryRecord.combine(userText, assistantText);
        MemoryRecord record = MemoryRecord.builder()
                .id(UUID.randomUUID().toString())
                .vector(context.getEmbeddingClient().embed(combined))
                .userText(userText)
                .assistantText(assistantText)
                .combinedText(combined)
                .referencedFiles(files == null ? new LinkedHashSet<>() : new LinkedHashSet<>(files))
                .tags(tags == null ? List.of() : List.copyOf(tags))
                .createdAt(clock.instant())
                .build();

        UpsertReport report = context.getIndexStore().upsert(context.getMemoryCollection(), List.of(record));
        if (!report.isSuccessful()) {
            throw new IndexStoreException("Memory entry " + record.getId() + " was not stored: "
                    + (report.getFailedBatches().isEmpty()
                    ? report.getRejectedRecords().get(0).getReason()
                    : report.getFailedBatches().get(0).getMessage()));
        }
        log.debug("[Memory] Stored entry {} ({} files, tags {})", record.getId(),
                record.getReferencedFiles().size(), record.getTags());
        return record;
    }

    /**
     * Entries closest to the query, best first. Scores are not returned.
     */
    public List<MemoryRecord> recall(String query, int limit) {
        List<Float> vector = context.getEmbeddingClient().embed(query);
        List<SearchHit> hits = context.getIndexStore().denseSearch(
                context.getMemoryCollection(), vector, context.getVectorField(), limit);
        log.debug("[Memory] Recalled {} entries", hits.size());
        return hits.stream()
                .map(hit -> MemoryRecord.fromPayload(hit.getId(), hit.getPayload()))
                .collect(Collectors.toList());
    }
}
