package com.architecture.memory.recall.service.extract;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Line view of a source file. Lines split on {@code \n}, {@code \r\n} or {@code \r};
 * a trailing line terminator does not produce an empty last line.
 */
public final class SourceLines {

    private final List<String> lines;

    private SourceLines(List<String> lines) {
        this.lines = lines;
    }

    public static SourceLines of(String text) {
        return new SourceLines(text == null ? List.of() : text.lines().collect(Collectors.toList()));
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * @param lineNumber 1-based line number
     */
    public String line(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    /**
     * Exact text of lines {@code start..end}, 1-based and inclusive, joined with {@code \n}.
     * Bounds are clamped to the file.
     */
    public String slice(int start, int end) {
        int from = Math.max(1, start);
        int to = Math.min(lines.size(), Math.max(from, end));
        if (from > lines.size()) {
            return "";
        }
        return String.join("\n", lines.subList(from - 1, to));
    }
}
