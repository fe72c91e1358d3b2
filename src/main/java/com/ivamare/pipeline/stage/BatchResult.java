package com.ivamare.pipeline.stage;

import java.util.List;
import java.util.Map;

/**
 * Outcome of polling an analysis batch.
 *
 * @param batchId Batch identifier
 * @param status Processing status
 * @param results Per-document results, present when completed
 * @param failedIds Documents whose analysis failed inside a completed batch
 */
public record BatchResult(
    String batchId,
    BatchStatus status,
    Map<String, Object> results,
    List<String> failedIds
) {
    public BatchResult {
        results = results != null ? Map.copyOf(results) : Map.of();
        failedIds = failedIds != null ? List.copyOf(failedIds) : List.of();
    }

    public static BatchResult of(String batchId, BatchStatus status) {
        return new BatchResult(batchId, status, Map.of(), List.of());
    }
}
