package com.ivamare.pipeline.stage;

/**
 * Processing status of a submitted analysis batch.
 */
public enum BatchStatus {
    NOT_READY,
    COMPLETED,
    ERRORED,
    EXPIRED,
    CANCELLED
}
