package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.config.ExtractionSettings;
import com.architecture.memory.recall.model.ExtractionArtifact;
import com.architecture.memory.recall.model.FileExtraction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryExtractionServiceTest {

    @TempDir
    Path tmp;

    private Path repo;
    private Path work;

    private RepositoryExtractionService service;
    private ExtractionArtifactStore artifactStore;

    @BeforeEach
    void setUp() throws IOException {
        repo = Files.createDirectories(tmp.resolve("repo"));
        work = Files.createDirectories(tmp.resolve("work"));
        ExtractionSettings settings = new ExtractionSettings(3, 1, 200, ".java,.py", ".git,build",
                "verbatim", work.resolve("parsed_code.json").toString(), 1, work.resolve("clones").toString());
        artifactStore = new ExtractionArtifactStore();
        service = new RepositoryExtractionService(settings, new UnitExtractor(settings),
                new RepositorySourceResolver(settings), artifactStore);

        write("README.md", "# Demo\nA small repo.");
        write("src/A.java", "class A {\n    void run() {}\n}\n");
        write("src/B.java", "class B { void x( { }\n");
        write("src/C.java", "class C {\n");
        write("scripts/tool.py", "print('hi')\n");
        write("build/Generated.java", "class Generated {}\n");
        write(".git/Hook.java", "class Hook {}\n");
        write("notes.txt", "not source\n");
        write("Big.java", "class Big {\n" + "    int field;\n".repeat(20) + "}\n");
    }

    private void write(String relPath, String content) throws IOException {
        Path file = repo.resolve(relPath);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void walksIncludedFilesInSortedOrder_skippingExcludedDirectories() {
        ExtractionArtifact artifact = service.extract(repo);

        assertThat(artifact.getParsedCode().keySet())
                .containsExactly("Big.java", "scripts/tool.py", "src/A.java", "src/B.java", "src/C.java");
        assertThat(artifact.getRepoRoot()).isEqualTo(repo.toAbsolutePath().normalize().toString());
        assertThat(artifact.getReadme()).isEqualTo("# Demo\nA small repo.");
    }

    @Test
    void oversizedFileIsSkippedWithoutUnits() {
        ExtractionArtifact artifact = service.extract(repo);
        FileExtraction big = artifact.getParsedCode().get("Big.java");

        assertThat(big.isSkipped()).isTrue();
        assertThat(big.getSyntaxError()).startsWith(FileExtraction.SKIPPED_PREFIX).contains("exceeds 200 bytes");
        assertThat(big.allUnits()).isEmpty();
        assertThat(artifact.getStats().getNumSkippedFiles()).isEqualTo(1);
    }

    @Test
    void syntaxErrorsAreCountedButRecordedUpToTheCap() {
        ExtractionArtifact artifact = service.extract(repo);

        assertThat(artifact.getStats().getNumSyntaxErrors()).isEqualTo(2);
        assertThat(artifact.getSyntaxErrors()).hasSize(1);
        assertThat(artifact.getSyntaxErrors().get(0).getFile()).isEqualTo("src/B.java");
        assertThat(artifact.getParsedCode().get("src/B.java").getFileChunks()).isNotEmpty();
    }

    @Test
    void statsDescribeTheRun() {
        ExtractionArtifact artifact = service.extract(repo);

        assertThat(artifact.getStats().getNumFiles()).isEqualTo(5);
        assertThat(artifact.getStats().getChunkLines()).isEqualTo(3);
        assertThat(artifact.getStats().getChunkOverlap()).isEqualTo(1);
        // A.java: class + method + 1 window; tool.py, B.java and C.java: 1 window each
        assertThat(artifact.getStats().getNumUnits()).isEqualTo(6);
    }

    @Test
    void fallsBackToNestedReadme() throws IOException {
        Files.delete(repo.resolve("README.md"));
        write("docs/ReadMe.md", "nested readme");

        assertThat(service.extract(repo).getReadme()).isEqualTo("nested readme");
    }

    @Test
    void extractAndWrite_producesReadableArtifact() throws IOException {
        Path output = work.resolve("out/parsed.json");

        service.extractAndWrite(repo.toString(), null, output.toString());

        String json = Files.readString(output);
        assertThat(json).contains("\"repo_root\"", "\"parsed_code\"", "\"ast_items\"", "\"file_chunks\"",
                "\"syntax_errors\"", "\"num_skipped_files\"", "\"start_line\"", "\"FileChunk\"");

        ExtractionArtifact reread = artifactStore.read(output);
        assertThat(reread.getParsedCode()).containsKeys("src/A.java", "Big.java");
        assertThat(reread.getParsedCode().get("src/A.java").getAstItems()).hasSize(2);
    }

    @Test
    void missingLocalPathWithoutUrlFails() {
        assertThatThrownBy(() -> service.extractAndWrite(repo.resolve("missing").toString(), null, null))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void deeplyNestedFileKeepsWindowsAndDoesNotStopOtherFiles() throws IOException {
        Path nested = Files.createDirectories(tmp.resolve("nested"));
        Files.writeString(nested.resolve("A.java"), "class A {\n    void run() {}\n}\n");
        Files.writeString(nested.resolve("Z.java"), JavaSourceParserTest.deepConcatenation(50_000));
        ExtractionSettings settings = new ExtractionSettings(3, 1, 1_000_000, ".java", ".git",
                "verbatim", work.resolve("nested.json").toString(), 10, work.resolve("clones").toString());
        RepositoryExtractionService nestedService = new RepositoryExtractionService(settings,
                new UnitExtractor(settings), new RepositorySourceResolver(settings), artifactStore);

        ExtractionArtifact artifact = nestedService.extract(nested);

        assertThat(artifact.getParsedCode().keySet()).containsExactly("A.java", "Z.java");
        assertThat(artifact.getParsedCode().get("A.java").getAstItems()).hasSize(2);
        FileExtraction deep = artifact.getParsedCode().get("Z.java");
        assertThat(deep.hasParseError()).isTrue();
        assertThat(deep.getFileChunks()).isNotEmpty();
    }
}
