package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.config.ExtractionSettings;
import com.architecture.memory.recall.model.ExtractionArtifact;
import com.architecture.memory.recall.model.ExtractionError;
import com.architecture.memory.recall.model.ExtractionStats;
import com.architecture.memory.recall.model.FileExtraction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Walks a repository and produces the extraction artifact.
 * <p>
 * Oversized or unreadable files are recorded as skipped with no units, never truncated.
 * A parse failure is recorded per file and the file still gets its line windows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepositoryExtractionService {

    private static final List<String> README_NAMES = List.of("README.md", "readme.md", "Readme.md");

    private final ExtractionSettings settings;
    private final UnitExtractor unitExtractor;
    private final RepositorySourceResolver sourceResolver;
    private final ExtractionArtifactStore artifactStore;

    /**
     * Resolves the repository, extracts it and writes the artifact.
     *
     * @param outputPath artifact location, or {@code null} for the configured default
     */
    public ExtractionArtifact extractAndWrite(String localPath, String repositoryUrl, String outputPath) {
        Path repoRoot = sourceResolver.resolve(localPath, repositoryUrl);
        ExtractionArtifact artifact = extract(repoRoot);
        Path output = Paths.get(outputPath == null || outputPath.isBlank() ? settings.getOutput() : outputPath);
        artifactStore.write(artifact, output);
        return artifact;
    }

    public ExtractionArtifact extract(Path repoRoot) {
        Path root = repoRoot.toAbsolutePath().normalize();
        log.info("[Extractor] Parsing repository at {}", root);
        long startTime = System.currentTimeMillis();

        String readme = extractReadme(root);
        List<Path> files = listSourceFiles(root);

        Map<String, FileExtraction> parsed = new LinkedHashMap<>();
        List<ExtractionError> syntaxErrors = new ArrayList<>();
        int skipped = 0;
        int units = 0;

        for (Path file : files) {
            String relPath = root.relativize(file).toString().replace('\\', '/');
            FileRead read = readText(file);
            if (read.skipReason != null) {
                log.warn("[Extractor] Skipping {}: {}", relPath, read.skipReason);
                parsed.put(relPath, FileExtraction.skipped(read.skipReason));
                skipped++;
                continue;
            }

            FileExtraction extraction = unitExtractor.extract(relPath, read.content);
            if (extraction.hasParseError()) {
                syntaxErrors.add(ExtractionError.builder()
                        .file(relPath)
                        .error(extraction.getSyntaxError())
                        .build());
            }
            units += extraction.getAstItems().size() + extraction.getFileChunks().size();
            parsed.put(relPath, extraction);
        }

        ExtractionStats stats = ExtractionStats.builder()
                .numFiles(files.size())
                .numSyntaxErrors(syntaxErrors.size())
                .numSkippedFiles(skipped)
                .numUnits(units)
                .chunkLines(settings.getChunkLines())
                .chunkOverlap(settings.getChunkOverlap())
                .build();

        log.info("[Extractor] Parsed {} files into {} units in {}ms (syntax errors: {}, skipped: {})",
                files.size(), units, System.currentTimeMillis() - startTime, syntaxErrors.size(), skipped);
        if (!syntaxErrors.isEmpty()) {
            log.warn("[Extractor] Syntax errors in {} files (still chunked and included). Example: {}",
                    syntaxErrors.size(), syntaxErrors.get(0));
        }

        return ExtractionArtifact.builder()
                .repoRoot(root.toString())
                .readme(readme)
                .parsedCode(parsed)
                .stats(stats)
                .syntaxErrors(new ArrayList<>(syntaxErrors.subList(0,
                        Math.min(syntaxErrors.size(), settings.getMaxRecordedErrors()))))
                .build();
    }

    List<Path> listSourceFiles(Path root) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && dir.getFileName() != null
                            && settings.getExcludeDirs().contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && settings.getIncludeExtensions()
                            .contains(SourceLanguage.extensionOf(file.getFileName().toString()))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("[Extractor] Cannot visit {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ExtractionException("Failed to walk repository " + root, e);
        }
        files.sort(Comparator.comparing(path -> root.relativize(path).toString().replace('\\', '/')));
        return files;
    }

    String extractReadme(Path root) {
        for (String candidate : README_NAMES) {
            Path readme = root.resolve(candidate);
            if (Files.isRegularFile(readme)) {
                FileRead read = readText(readme);
                return read.content == null ? "" : read.content;
            }
        }
        try (var paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).equals("readme.md"))
                    .sorted()
                    .map(this::readText)
                    .filter(read -> read.content != null && !read.content.isEmpty())
                    .map(read -> read.content)
                    .findFirst()
                    .orElse("");
        } catch (IOException e) {
            log.warn("[Extractor] README lookup failed under {}: {}", root, e.getMessage());
            return "";
        }
    }

    private FileRead readText(Path file) {
        try {
            long size = Files.size(file);
            if (size > settings.getMaxFileBytes()) {
                return FileRead.skipped("file exceeds " + settings.getMaxFileBytes() + " bytes (" + size + " bytes)");
            }
            byte[] bytes = Files.readAllBytes(file);
            String content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return FileRead.of(content);
        } catch (CharacterCodingException e) {
            return FileRead.skipped("unreadable (" + e.getMessage() + ")");
        } catch (IOException e) {
            return FileRead.skipped("unreadable (" + e.getMessage() + ")");
        }
    }

    private static final class FileRead {
        private final String content;
        private final String skipReason;

        private FileRead(String content, String skipReason) {
            this.content = content;
            this.skipReason = skipReason;
        }

        static FileRead of(String content) {
            return new FileRead(content, null);
        }

        static FileRead skipped(String reason) {
            return new FileRead(null, reason);
        }
    }
}
