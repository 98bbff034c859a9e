package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.model.RetrievalUnit;
import com.architecture.memory.recall.model.UnitType;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a file into overlapping line windows that together cover every line.
 * <p>
 * Windows are {@code chunkLines} long and advance by {@code max(1, chunkLines - overlap)},
 * so consecutive windows share {@code overlap} lines. The last window ends on the last
 * line of the file and may be shorter.
 */
public class LineWindowChunker {

    private final int chunkLines;
    private final int overlap;

    public LineWindowChunker(int chunkLines, int overlap) {
        if (chunkLines <= 0) {
            throw new IllegalArgumentException("chunkLines must be positive");
        }
        if (overlap < 0 || overlap >= chunkLines) {
            throw new IllegalArgumentException("overlap must be non-negative and less than chunkLines");
        }
        this.chunkLines = chunkLines;
        this.overlap = overlap;
    }

    public List<LineWindow> windows(SourceLines lines) {
        List<LineWindow> windows = new ArrayList<>();
        int n = lines.size();
        if (n == 0) {
            return windows;
        }
        int step = Math.max(1, chunkLines - overlap);
        int start = 0;
        while (start < n) {
            int end = Math.min(n, start + chunkLines);
            windows.add(new LineWindow(start + 1, end, lines.slice(start + 1, end)));
            if (end == n) {
                break;
            }
            start += step;
        }
        return windows;
    }

    public List<RetrievalUnit> chunk(String relPath, SourceLines lines, String language) {
        List<RetrievalUnit> units = new ArrayList<>();
        for (LineWindow window : windows(lines)) {
            units.add(RetrievalUnit.builder()
                    .type(UnitType.FILE_CHUNK)
                    .name(String.format("%s::chunk_%d_%d", relPath, window.getStartLine(), window.getEndLine()))
                    .symbol("")
                    .startLine(window.getStartLine())
                    .endLine(window.getEndLine())
                    .docstring("")
                    .code(window.getText())
                    .precedingComments(List.of())
                    .language(language)
                    .build());
        }
        return units;
    }

    @lombok.Value
    public static class LineWindow {
        int startLine;
        int endLine;
        String text;
    }
}
