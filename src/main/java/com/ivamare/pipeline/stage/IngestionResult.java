package com.ivamare.pipeline.stage;

import java.util.List;

/**
 * Documents written by one ingestion run.
 *
 * @param newIds Documents stored for the first time
 * @param updatedIds Documents whose text changed
 */
public record IngestionResult(List<String> newIds, List<String> updatedIds) {

    public IngestionResult {
        newIds = newIds != null ? List.copyOf(newIds) : List.of();
        updatedIds = updatedIds != null ? List.copyOf(updatedIds) : List.of();
    }

    public static IngestionResult empty() {
        return new IngestionResult(List.of(), List.of());
    }
}
