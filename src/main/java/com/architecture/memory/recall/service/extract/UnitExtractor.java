package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.config.ExtractionSettings;
import com.architecture.memory.recall.model.FileExtraction;
import com.architecture.memory.recall.model.RetrievalUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns one file's text into retrieval units.
 * <p>
 * The syntactic pass runs when a parser supports the file's extension; its failure is
 * recorded and never stops the file. The windowing pass always runs so that every line
 * stays retrievable.
 */
@Service
@Slf4j
public class UnitExtractor {

    private final List<SourceParser> parsers;
    private final LineWindowChunker chunker;

    @Autowired
    public UnitExtractor(ExtractionSettings settings) {
        this(List.of(new JavaSourceParser(new CodeTextExtractor(settings.getCodeTextMode()))),
                new LineWindowChunker(settings.getChunkLines(), settings.getChunkOverlap()));
    }

    public UnitExtractor(List<SourceParser> parsers, LineWindowChunker chunker) {
        this.parsers = List.copyOf(parsers);
        this.chunker = chunker;
    }

    public FileExtraction extract(String relPath, String content) {
        String extension = SourceLanguage.extensionOf(relPath);
        String language = SourceLanguage.forPath(relPath);
        SourceLines lines = SourceLines.of(content);

        ParsedSource parsed = parsers.stream()
                .filter(parser -> parser.supports(extension))
                .findFirst()
                .map(parser -> parser.parse(relPath, content))
                .orElseGet(ParsedSource::empty);

        if (parsed.getSyntaxError() != null) {
            log.debug("[Extractor] {} kept as line windows only: {}", relPath, parsed.getSyntaxError());
        }

        List<RetrievalUnit> windows = chunker.chunk(relPath, lines, language);

        return FileExtraction.builder()
                .astItems(parsed.getSyntaxError() == null ? parsed.getUnits() : List.of())
                .fileChunks(windows)
                .imports(parsed.getSyntaxError() == null ? parsed.getImports() : List.of())
                .globalVariables(parsed.getSyntaxError() == null ? parsed.getGlobalVariables() : List.of())
                .syntaxError(parsed.getSyntaxError())
                .build();
    }
}
