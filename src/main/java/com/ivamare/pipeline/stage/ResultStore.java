package com.ivamare.pipeline.stage;

/**
 * Durable storage for analysis results.
 *
 * <p>{@link #commit} must be an upsert keyed by document: the same batch can be
 * committed more than once.
 */
public interface ResultStore {

    void commit(BatchResult result) throws Exception;
}
