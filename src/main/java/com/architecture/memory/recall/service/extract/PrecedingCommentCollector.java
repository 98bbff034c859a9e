package com.architecture.memory.recall.service.extract;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Collects the comment lines written directly above a declaration.
 * <p>
 * Walks upward from the line above the declaration. Lines starting with a comment marker
 * are collected with the marker stripped; blank lines and pass-through lines (block comment
 * delimiters and continuation lines) are stepped over; the first other line stops the walk.
 * Comments are returned top to bottom.
 */
public class PrecedingCommentCollector {

    private final List<String> commentMarkers;
    private final List<String> passThroughPrefixes;

    public PrecedingCommentCollector(List<String> commentMarkers, List<String> passThroughPrefixes) {
        this.commentMarkers = List.copyOf(commentMarkers);
        this.passThroughPrefixes = List.copyOf(passThroughPrefixes);
    }

    /**
     * @param declarationLine 1-based first line of the declaration
     */
    public List<String> collect(SourceLines lines, int declarationLine) {
        LinkedList<String> comments = new LinkedList<>();
        for (int lineNumber = Math.min(declarationLine - 1, lines.size()); lineNumber >= 1; lineNumber--) {
            String line = lines.line(lineNumber).strip();
            String marker = markerOf(line);
            if (marker != null) {
                comments.addFirst(line.substring(marker.length()).strip());
            } else if (!line.isEmpty() && !isPassThrough(line)) {
                break;
            }
        }
        return new ArrayList<>(comments);
    }

    private String markerOf(String line) {
        for (String marker : commentMarkers) {
            if (line.startsWith(marker)) {
                return marker;
            }
        }
        return null;
    }

    private boolean isPassThrough(String line) {
        for (String prefix : passThroughPrefixes) {
            if (line.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
