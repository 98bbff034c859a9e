package com.architecture.memory.recall.service.ingest;

import com.architecture.memory.recall.config.IngestSettings;
import com.architecture.memory.recall.model.CodeRecord;
import com.architecture.memory.recall.model.ExtractionArtifact;
import com.architecture.memory.recall.model.FileExtraction;
import com.architecture.memory.recall.model.IngestReport;
import com.architecture.memory.recall.model.RetrievalUnit;
import com.architecture.memory.recall.model.UnitType;
import com.architecture.memory.recall.model.UpsertReport;
import com.architecture.memory.recall.service.RetrievalContext;
import com.architecture.memory.recall.service.extract.ExtractionArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads an extraction artifact and writes its units into the codebase collection.
 * <p>
 * Every file's declarations come first, then its line windows. Units whose code is blank are
 * skipped. Ids come from {@link RecordIdGenerator}, so running this twice over the same
 * artifact leaves the collection unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodebaseIngestService {

    private final RetrievalContext context;
    private final ExtractionArtifactStore artifactStore;
    private final RecordIdGenerator idGenerator;
    private final IngestSettings settings;

    public IngestReport ingest(Path artifactPath) {
        return ingest(artifactStore.read(artifactPath));
    }

    public IngestReport ingest(ExtractionArtifact artifact) {
        long startTime = System.currentTimeMillis();
        String repoRoot = artifact.getRepoRoot() == null ? "" : artifact.getRepoRoot();
        log.info("[Ingest] Ingesting {} files from {}", artifact.getParsedCode().size(),
                repoRoot.isEmpty() ? "(unknown root)" : repoRoot);

        context.getIndexStore().ensureCollections();

        List<PendingUnit> pending = new ArrayList<>();
        int blank = 0;
        for (Map.Entry<String, FileExtraction> entry : artifact.getParsedCode().entrySet()) {
            for (RetrievalUnit unit : entry.getValue().allUnits()) {
                String code = unit.getCode() == null ? "" : unit.getCode().trim();
                if (code.isEmpty()) {
                    blank++;
                    continue;
                }
                pending.add(new PendingUnit(entry.getKey(), unit, code));
            }
        }

        List<CodeRecord> records = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i += settings.getBatchSize()) {
            List<PendingUnit> group = pending.subList(i, Math.min(i + settings.getBatchSize(), pending.size()));
            List<List<Float>> vectors = context.getEmbeddingClient().embedAll(group.stream()
                    .map(PendingUnit::getCode)
                    .collect(Collectors.toList()));
            for (int j = 0; j < group.size(); j++) {
                records.add(toRecord(group.get(j), vectors.get(j), repoRoot));
            }
            log.debug("[Ingest] Embedded {}/{} units", records.size(), pending.size());
        }

        UpsertReport upsert = context.getIndexStore().upsert(context.getCodebaseCollection(), records);
        long count = context.getIndexStore().count(context.getCodebaseCollection());
        long duration = System.currentTimeMillis() - startTime;

        if (upsert.isSuccessful()) {
            log.info("[Ingest] Completed: {} records, {} blank units skipped, collection holds {} in {}ms",
                    records.size(), blank, count, duration);
        } else {
            log.error("[Ingest] Completed with failures: {} failed batches, {} rejected records",
                    upsert.getFailedBatches().size(), upsert.getRejectedRecords().size());
        }

        return IngestReport.builder()
                .repoRoot(repoRoot)
                .files(artifact.getParsedCode().size())
                .recordsBuilt(records.size())
                .blankUnitsSkipped(blank)
                .collectionCount(count)
                .durationMs(duration)
                .upsert(upsert)
                .build();
    }

    private CodeRecord toRecord(PendingUnit pending, List<Float> vector, String repoRoot) {
        RetrievalUnit unit = pending.getUnit();
        return CodeRecord.builder()
                .id(idGenerator.generate(pending.getFile(), unit))
                .vector(vector)
                .file(pending.getFile())
                .name(unit.getName() == null ? "" : unit.getName())
                .symbol(unit.getSymbol())
                .type(UnitType.labelOf(unit.getType()))
                .language(unit.getLanguage())
                .startLine(unit.getStartLine())
                .endLine(unit.getEndLine())
                .docstring(unit.getDocstring())
                .precedingComments(unit.getPrecedingComments())
                .code(pending.getCode())
                .repoRoot(repoRoot)
                .build();
    }

    @lombok.Value
    private static class PendingUnit {
        String file;
        RetrievalUnit unit;
        String code;
    }
}
