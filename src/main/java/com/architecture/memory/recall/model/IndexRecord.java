package com.architecture.memory.recall.model;

import java.util.List;
import java.util.Map;

/**
 * Persisted form of a retrieval unit or a memory entry: id, dense vector and flat payload.
 *
 * @see CodeRecord
 * @see MemoryRecord
 */
public interface IndexRecord {

    String getId();

    List<Float> getVector();

    /**
     * Flat payload written to the store, typed fields first, then any passthrough attributes.
     */
    Map<String, Object> toPayload();
}
