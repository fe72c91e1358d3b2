package com.ivamare.pipeline.stage;

import java.util.List;
import java.util.Map;

/**
 * Fetches and stores documents. Implementations must be idempotent: a redelivered
 * trigger runs the same ingestion again.
 */
public interface IngestionService {

    /**
     * Incremental ingestion run triggered by the schedule.
     *
     * @param payload trigger arguments, e.g. {@code offset}, {@code date_since_days}
     * @return documents written
     * @throws Exception on any failure; the trigger is redelivered
     */
    IngestionResult ingest(Map<String, Object> payload) throws Exception;

    /**
     * Ingest specific documents.
     *
     * @param urls document URLs
     * @return documents written
     * @throws Exception on any failure; the chunk is redelivered
     */
    IngestionResult ingestUrls(List<String> urls) throws Exception;
}
