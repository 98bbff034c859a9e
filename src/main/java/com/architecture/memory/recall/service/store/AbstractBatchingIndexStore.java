package com.architecture.memory.recall.service.store;

import com.architecture.memory.recall.model.IndexRecord;
import com.architecture.memory.recall.model.UpsertReport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Shared upsert path: record validation, batching and concurrent batch writes.
 * <p>
 * Records with a missing id or a vector of the wrong dimension are rejected individually and
 * never sent. A batch the backend refuses fails as a whole and is reported by its index.
 * Multi-batch upserts run on the shared executor; a single-batch upsert runs on the caller.
 */
@Slf4j
public abstract class AbstractBatchingIndexStore implements IndexStore {

    private final Map<String, CollectionSpec> collections = new LinkedHashMap<>();
    private final int batchSize;
    private final Executor executor;

    protected AbstractBatchingIndexStore(List<CollectionSpec> collections, int batchSize, Executor executor) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        collections.forEach(spec -> this.collections.put(spec.getName(), spec));
        this.batchSize = batchSize;
        this.executor = executor;
    }

    @Override
    public List<CollectionSpec> getCollections() {
        return List.copyOf(collections.values());
    }

    protected CollectionSpec spec(String collection) {
        CollectionSpec spec = collections.get(collection);
        if (spec == null) {
            throw new IndexStoreException("Unknown collection: " + collection);
        }
        return spec;
    }

    @Override
    public UpsertReport upsert(String collection, List<? extends IndexRecord> records) {
        CollectionSpec spec = spec(collection);

        List<IndexRecord> accepted = new ArrayList<>();
        List<UpsertReport.RejectedRecord> rejected = new ArrayList<>();
        for (IndexRecord record : records) {
            String reason = rejectionReason(record, spec);
            if (reason == null) {
                accepted.add(record);
            } else {
                log.warn("[Index Store] Rejected record {} for '{}': {}", record.getId(), collection, reason);
                rejected.add(UpsertReport.RejectedRecord.builder()
                        .id(record.getId())
                        .reason(reason)
                        .build());
            }
        }

        List<List<IndexRecord>> batches = new ArrayList<>();
        for (int i = 0; i < accepted.size(); i += batchSize) {
            batches.add(accepted.subList(i, Math.min(i + batchSize, accepted.size())));
        }

        // a single batch never waits on the shared executor
        Executor writer = batches.size() == 1 ? Runnable::run : executor;
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (List<IndexRecord> batch : batches) {
            writes.add(CompletableFuture.runAsync(() -> writeBatch(spec, batch), writer));
        }

        int upserted = 0;
        List<UpsertReport.BatchFailure> failures = new ArrayList<>();
        for (int i = 0; i < writes.size(); i++) {
            try {
                writes.get(i).join();
                upserted += batches.get(i).size();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[Index Store] Batch {} ({} records) failed for '{}': {}",
                        i, batches.get(i).size(), collection, cause.getMessage());
                failures.add(UpsertReport.BatchFailure.builder()
                        .batchIndex(i)
                        .size(batches.get(i).size())
                        .message(cause.getMessage())
                        .build());
            }
        }

        log.info("[Index Store] Upserted {}/{} records into '{}' in {} batches ({} failed, {} rejected)",
                upserted, records.size(), collection, batches.size(), failures.size(), rejected.size());

        return UpsertReport.builder()
                .collection(collection)
                .totalRecords(records.size())
                .upsertedRecords(upserted)
                .batchCount(batches.size())
                .failedBatches(failures)
                .rejectedRecords(rejected)
                .build();
    }

    /**
     * Writes one batch, replacing records with the same id. Throws if the backend refuses it.
     */
    protected abstract void writeBatch(CollectionSpec spec, List<IndexRecord> batch);

    private static String rejectionReason(IndexRecord record, CollectionSpec spec) {
        if (record.getId() == null || record.getId().isBlank()) {
            return "missing id";
        }
        if (record.getVector() == null) {
            return "missing vector";
        }
        if (record.getVector().size() != spec.getDimension()) {
            return "vector dimension " + record.getVector().size() + ", expected " + spec.getDimension();
        }
        return null;
    }
}
