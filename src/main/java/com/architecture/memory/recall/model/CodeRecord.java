package com.architecture.memory.recall.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index record for the codebase collection.
 */
@Value
@Builder(toBuilder = true)
public class CodeRecord implements IndexRecord {

    public static final String FIELD_FILE = "file";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_SYMBOL = "symbol";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_START_LINE = "start_line";
    public static final String FIELD_END_LINE = "end_line";
    public static final String FIELD_DOCSTRING = "docstring";
    public static final String FIELD_PRECEDING_COMMENTS = "preceding_comments";
    public static final String FIELD_CODE = "code";
    public static final String FIELD_REPO_ROOT = "repo_root";

    /**
     * Payload fields the keyword leg matches tokens against.
     */
    public static final List<String> LEXICAL_FIELDS = List.of(FIELD_CODE, FIELD_NAME, FIELD_FILE, FIELD_DOCSTRING);

    private static final Set<String> TYPED_FIELDS = Set.of(
            FIELD_FILE, FIELD_NAME, FIELD_SYMBOL, FIELD_TYPE, FIELD_LANGUAGE, FIELD_START_LINE,
            FIELD_END_LINE, FIELD_DOCSTRING, FIELD_PRECEDING_COMMENTS, FIELD_CODE, FIELD_REPO_ROOT);

    String id;
    List<Float> vector;
    String file;
    String name;
    String symbol;
    String type;
    String language;
    int startLine;
    int endLine;
    String docstring;
    List<String> precedingComments;
    String code;
    String repoRoot;

    /**
     * Forward-compatible passthrough attributes; never holds a typed field.
     */
    @Builder.Default
    Map<String, Object> extra = Collections.emptyMap();

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FIELD_FILE, file);
        payload.put(FIELD_NAME, name);
        payload.put(FIELD_SYMBOL, symbol == null ? "" : symbol);
        payload.put(FIELD_TYPE, type);
        payload.put(FIELD_LANGUAGE, language);
        payload.put(FIELD_START_LINE, startLine);
        payload.put(FIELD_END_LINE, endLine);
        payload.put(FIELD_DOCSTRING, docstring == null ? "" : docstring);
        payload.put(FIELD_PRECEDING_COMMENTS, precedingComments == null ? List.of() : precedingComments);
        payload.put(FIELD_CODE, code);
        payload.put(FIELD_REPO_ROOT, repoRoot == null ? "" : repoRoot);
        extra.forEach(payload::putIfAbsent);
        return payload;
    }

    /**
     * Typed view of a payload returned by a search; the vector is not carried.
     */
    public static CodeRecord fromPayload(String id, Map<String, Object> payload) {
        Map<String, Object> extra = new LinkedHashMap<>();
        payload.forEach((key, value) -> {
            if (!TYPED_FIELDS.contains(key)) {
                extra.put(key, value);
            }
        });
        int start = PayloadValues.integer(payload, FIELD_START_LINE, 1);
        return CodeRecord.builder()
                .id(id)
                .file(PayloadValues.string(payload, FIELD_FILE))
                .name(PayloadValues.string(payload, FIELD_NAME))
                .symbol(PayloadValues.string(payload, FIELD_SYMBOL))
                .type(PayloadValues.string(payload, FIELD_TYPE))
                .language(PayloadValues.string(payload, FIELD_LANGUAGE))
                .startLine(start)
                .endLine(PayloadValues.integer(payload, FIELD_END_LINE, start))
                .docstring(PayloadValues.string(payload, FIELD_DOCSTRING))
                .precedingComments(PayloadValues.strings(payload, FIELD_PRECEDING_COMMENTS))
                .code(PayloadValues.string(payload, FIELD_CODE))
                .repoRoot(PayloadValues.string(payload, FIELD_REPO_ROOT))
                .extra(extra)
                .build();
    }
}
