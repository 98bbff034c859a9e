package com.architecture.memory.recall.service.ingest;

import com.architecture.memory.recall.config.IngestSettings;
import com.architecture.memory.recall.model.ExtractionArtifact;
import com.architecture.memory.recall.model.FileExtraction;
import com.architecture.memory.recall.model.IngestReport;
import com.architecture.memory.recall.model.RetrievalUnit;
import com.architecture.memory.recall.model.SearchHit;
import com.architecture.memory.recall.model.UnitType;
import com.architecture.memory.recall.service.RetrievalContext;
import com.architecture.memory.recall.service.extract.ExtractionArtifactStore;
import com.architecture.memory.recall.service.extract.ExtractionException;
import com.architecture.memory.recall.support.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.architecture.memory.recall.support.TestContexts.CODEBASE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodebaseIngestServiceTest {

    @TempDir
    Path tmp;

    private RetrievalContext context;
    private ExtractionArtifactStore artifactStore;
    private RecordIdGenerator idGenerator;
    private CodebaseIngestService service;

    @BeforeEach
    void setUp() {
        context = TestContexts.inMemory(2);
        artifactStore = new ExtractionArtifactStore();
        idGenerator = new RecordIdGenerator();
        service = new CodebaseIngestService(context, artifactStore, idGenerator, new IngestSettings(2, 1, 1, 0));
    }

    private static ExtractionArtifact artifact() {
        RetrievalUnit charge = RetrievalUnit.builder()
                .type(UnitType.FUNCTION)
                .name("src/Billing.java::Billing.charge")
                .symbol("Billing.charge")
                .startLine(3)
                .endLine(5)
                .docstring("Charges the card.")
                .code("    void charge() {\n        gateway.send();\n    }\n")
                .precedingComments(List.of())
                .language("java")
                .build();
        RetrievalUnit window = RetrievalUnit.builder()
                .type(UnitType.FILE_CHUNK)
                .name("src/Billing.java::chunk_1_6")
                .startLine(1)
                .endLine(6)
                .docstring("")
                .code("class Billing {\n    void charge() {}\n}\n")
                .precedingComments(List.of())
                .language("java")
                .build();
        RetrievalUnit blank = window.toBuilder()
                .name("src/Billing.java::chunk_7_9")
                .startLine(7)
                .endLine(9)
                .code("  \n\n")
                .build();

        Map<String, FileExtraction> parsed = new LinkedHashMap<>();
        parsed.put("src/Billing.java", FileExtraction.builder()
                .astItems(new ArrayList<>(List.of(charge)))
                .fileChunks(new ArrayList<>(List.of(window, blank)))
                .build());
        parsed.put("notes.txt", FileExtraction.skipped("file exceeds 10 bytes (20 bytes)"));
        return ExtractionArtifact.builder()
                .repoRoot("/work/payments")
                .parsedCode(parsed)
                .build();
    }

    @Test
    void ingestsNonBlankUnitsWithPayload() {
        IngestReport report = service.ingest(artifact());

        assertThat(report.getFiles()).isEqualTo(2);
        assertThat(report.getRecordsBuilt()).isEqualTo(2);
        assertThat(report.getBlankUnitsSkipped()).isEqualTo(1);
        assertThat(report.getCollectionCount()).isEqualTo(2);
        assertThat(report.getUpsert().isSuccessful()).isTrue();

        List<SearchHit> hits = context.getIndexStore().lexicalSearch(CODEBASE, List.of("gateway"), 10);
        assertThat(hits).hasSize(1);
        Map<String, Object> payload = hits.get(0).getPayload();
        assertThat(payload)
                .containsEntry("file", "src/Billing.java")
                .containsEntry("type", "Function")
                .containsEntry("symbol", "Billing.charge")
                .containsEntry("start_line", 3)
                .containsEntry("repo_root", "/work/payments")
                .containsEntry("code", "void charge() {\n        gateway.send();\n    }");
        assertThat(hits.get(0).getId()).isEqualTo(idGenerator.generate("src/Billing.java", "Function",
                "Billing.charge", "src/Billing.java::Billing.charge", 3, 5));
    }

    @Test
    void reingestingSameArtifactKeepsCount() {
        service.ingest(artifact());
        IngestReport again = service.ingest(artifact());

        assertThat(again.getCollectionCount()).isEqualTo(2);
        assertThat(context.getIndexStore().count(CODEBASE)).isEqualTo(2);
    }

    @Test
    void ingestsArtifactFromDisk() {
        Path path = tmp.resolve("extracted_code.json");
        artifactStore.write(artifact(), path);

        IngestReport report = service.ingest(path);

        assertThat(report.getRecordsBuilt()).isEqualTo(2);
        assertThat(report.getRepoRoot()).isEqualTo("/work/payments");
    }

    @Test
    void missingArtifactFails() {
        assertThatThrownBy(() -> service.ingest(tmp.resolve("absent.json")))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Run extraction first");
    }

    @Test
    void unitsWithMissingOrUnrecognisedTypeAreIngestedAsUnknown() throws IOException {
        Path path = tmp.resolve("legacy.json");
        Files.writeString(path, """
                {
                  "repo_root": "/work/legacy",
                  "parsed_code": {
                    "docs/guide.md": {
                      "ast_items": [
                        {"name": "docs/guide.md::intro", "start_line": 1, "end_line": 4, "code": "Install guide"},
                        {"type": "Doc", "name": "docs/guide.md::usage", "start_line": 5, "end_line": 9,
                         "code": "Usage notes"}
                      ],
                      "file_chunks": []
                    }
                  }
                }
                """);

        IngestReport report = service.ingest(path);

        assertThat(report.getRecordsBuilt()).isEqualTo(2);
        List<SearchHit> hits = context.getIndexStore().lexicalSearch(CODEBASE, List.of("Install"), 10);
        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).getPayload()).containsEntry("type", "Unknown");
        assertThat(hits.get(0).getId()).isEqualTo(idGenerator.generate("docs/guide.md", "Unknown", "",
                "docs/guide.md::intro", 1, 4));
        assertThat(context.getIndexStore().lexicalSearch(CODEBASE, List.of("Usage"), 10).get(0).getPayload())
                .containsEntry("type", "Unknown");
    }
}
