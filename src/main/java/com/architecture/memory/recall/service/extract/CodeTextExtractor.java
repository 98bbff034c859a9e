package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.config.ExtractionSettings.CodeTextMode;
import com.github.javaparser.ast.Node;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces the code text of a declaration. The structured path prints the syntax node;
 * when printing is disabled or fails, the verbatim path slices the original lines
 * {@code start..end} exactly.
 */
@Slf4j
public class CodeTextExtractor {

    private final CodeTextMode mode;
    private final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();

    public CodeTextExtractor(CodeTextMode mode) {
        this.mode = mode;
    }

    public String extract(Node node, SourceLines lines, int startLine, int endLine) {
        if (mode == CodeTextMode.STRUCTURED) {
            try {
                return printer.print(node);
            } catch (RuntimeException e) {
                log.debug("[Extractor] Printing failed at line {}, using source lines: {}", startLine, e.getMessage());
            } catch (StackOverflowError e) {
                log.debug("[Extractor] Node at line {} nests too deeply to print, using source lines", startLine);
            }
        }
        return lines.slice(startLine, endLine);
    }
}
