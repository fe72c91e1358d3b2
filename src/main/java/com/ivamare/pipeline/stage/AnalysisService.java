package com.ivamare.pipeline.stage;

import java.util.List;

/**
 * Asynchronous batch analysis backed by a paid external API.
 */
public interface AnalysisService {

    /**
     * Submit documents for analysis.
     *
     * @param ids document IDs
     * @param type {@link PipelineActions#TYPE_NEW} or {@link PipelineActions#TYPE_UPDATED}
     * @return batch ID
     * @throws Exception on any failure; the work item is redelivered
     */
    String submit(List<String> ids, String type) throws Exception;

    /**
     * Check a submitted batch.
     *
     * @param batchId batch ID
     * @return current status and, when completed, results
     * @throws Exception on any failure
     */
    BatchResult poll(String batchId) throws Exception;
}
