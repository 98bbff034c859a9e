package com.architecture.memory.recall.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One stored chat exchange in the memory collection.
 */
@Value
@Builder(toBuilder = true)
public class MemoryRecord implements IndexRecord {

    public static final String FIELD_USER = "user";
    public static final String FIELD_ASSISTANT = "assistant";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_FILES = "files";
    public static final String FIELD_TAGS = "tags";
    public static final String FIELD_TIMESTAMP = "timestamp";

    private static final Set<String> TYPED_FIELDS = Set.of(
            FIELD_USER, FIELD_ASSISTANT, FIELD_TEXT, FIELD_FILES, FIELD_TAGS, FIELD_TIMESTAMP);

    String id;
    List<Float> vector;
    String userText;
    String assistantText;

    /**
     * The text that was embedded: {@code User: ...\nAssistant: ...}.
     */
    String combinedText;

    @Builder.Default
    Set<String> referencedFiles = Collections.emptySet();

    @Builder.Default
    List<String> tags = Collections.emptyList();

    Instant createdAt;

    @Builder.Default
    Map<String, Object> extra = Collections.emptyMap();

    public static String combine(String userText, String assistantText) {
        return "User: " + userText + "\nAssistant: " + assistantText;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FIELD_USER, userText);
        payload.put(FIELD_ASSISTANT, assistantText);
        payload.put(FIELD_TEXT, combinedText);
        payload.put(FIELD_FILES, new ArrayList<>(referencedFiles));
        payload.put(FIELD_TAGS, new ArrayList<>(tags));
        payload.put(FIELD_TIMESTAMP, createdAt == null ? null : createdAt.toString());
        extra.forEach(payload::putIfAbsent);
        return payload;
    }

    public static MemoryRecord fromPayload(String id, Map<String, Object> payload) {
        Map<String, Object> extra = new LinkedHashMap<>();
        payload.forEach((key, value) -> {
            if (!TYPED_FIELDS.contains(key)) {
                extra.put(key, value);
            }
        });
        return MemoryRecord.builder()
                .id(id)
                .userText(PayloadValues.string(payload, FIELD_USER))
                .assistantText(PayloadValues.string(payload, FIELD_ASSISTANT))
                .combinedText(PayloadValues.string(payload, FIELD_TEXT))
                .referencedFiles(new LinkedHashSet<>(PayloadValues.strings(payload, FIELD_FILES)))
                .tags(PayloadValues.strings(payload, FIELD_TAGS))
                .createdAt(parseTimestamp(PayloadValues.string(payload, FIELD_TIMESTAMP)))
                .extra(extra)
                .build();
    }

    private static Instant parseTimestamp(String value) {
        if (value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
