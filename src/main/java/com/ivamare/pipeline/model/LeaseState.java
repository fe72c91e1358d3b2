package com.ivamare.pipeline.model;

/**
 * States of a worker's single-message lease.
 *
 * <pre>
 * IDLE -&gt; LEASED -&gt; PROCESSING -&gt; COMMITTED
 *                              \-&gt; FAILED
 * </pre>
 */
public enum LeaseState {
    /** Nothing leased; also the outcome of a receive that returned no message. */
    IDLE,
    /** A message has been received and its visibility timer is running. */
    LEASED,
    /** The handler is running. */
    PROCESSING,
    /** Downstream messages were enqueued and the lease acknowledged. */
    COMMITTED,
    /** Processing failed; the lease is left to expire. */
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
}
