package com.ivamare.pipeline.model;

/**
 * Point-in-time counts for one queue.
 *
 * @param queueName Queue name
 * @param visible Messages available for receive
 * @param inFlight Messages currently leased
 * @param deadLettered Messages in the associated dead-letter queue
 */
public record QueueStats(String queueName, long visible, long inFlight, long deadLettered) {

    public long depth() {
        return visible + inFlight;
    }
}
