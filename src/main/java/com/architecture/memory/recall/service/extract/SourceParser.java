package com.architecture.memory.recall.service.extract;

/**
 * Syntax-aware pass for one language. Implementations never throw on malformed input:
 * they report the problem in {@link ParsedSource#getSyntaxError()} with no units.
 */
public interface SourceParser {

    /**
     * @param extension lower-case file extension including the dot
     */
    boolean supports(String extension);

    ParsedSource parse(String relPath, String content);
}
