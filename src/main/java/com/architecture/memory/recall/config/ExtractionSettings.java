package com.architecture.memory.recall.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Repository walk and chunking settings.
 */
@Component
@Getter
public class ExtractionSettings {

    public enum CodeTextMode { STRUCTURED, VERBATIM }

    private final int chunkLines;
    private final int chunkOverlap;
    private final long maxFileBytes;
    private final Set<String> includeExtensions;
    private final Set<String> excludeDirs;
    private final CodeTextMode codeTextMode;
    private final String output;
    private final int maxRecordedErrors;
    private final String cloneDirectory;

    public ExtractionSettings(@Value("${extraction.chunk-lines:200}") int chunkLines,
                              @Value("${extraction.chunk-overlap:40}") int chunkOverlap,
                              @Value("${extraction.max-file-bytes:2097152}") long maxFileBytes,
                              @Value("${extraction.include-extensions:.java}") String includeExtensions,
                              @Value("${extraction.exclude-dirs:.git,.venv,venv,node_modules,dist,build,__pycache__,target,.idea,.gradle}") String excludeDirs,
                              @Value("${extraction.code-text:structured}") String codeTextMode,
                              @Value("${extraction.output:parsed_code.json}") String output,
                              @Value("${extraction.max-recorded-errors:200}") int maxRecordedErrors,
                              @Value("${extraction.clone-directory:${java.io.tmpdir}/code-recall-repos}") String cloneDirectory) {
        if (chunkLines <= 0) {
            throw new IllegalArgumentException("extraction.chunk-lines must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkLines) {
            throw new IllegalArgumentException("extraction.chunk-overlap must be non-negative and less than chunk-lines");
        }
        this.chunkLines = chunkLines;
        this.chunkOverlap = chunkOverlap;
        this.maxFileBytes = maxFileBytes;
        this.includeExtensions = Arrays.stream(includeExtensions.split(","))
                .map(String::trim)
                .filter(ext -> !ext.isEmpty())
                .map(ext -> (ext.startsWith(".") ? ext : "." + ext).toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        this.excludeDirs = Arrays.stream(excludeDirs.split(","))
                .map(String::trim)
                .filter(dir -> !dir.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        this.codeTextMode = CodeTextMode.valueOf(codeTextMode.trim().toUpperCase(Locale.ROOT));
        this.output = output;
        this.maxRecordedErrors = maxRecordedErrors;
        this.cloneDirectory = cloneDirectory;
    }
}
