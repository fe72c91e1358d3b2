package com.ivamare.pipeline.worker;

import com.ivamare.pipeline.model.LeaseState;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Worker consuming one queue, one message per lease.
 *
 * <p>Each message is parsed as an action envelope and dispatched to the handler
 * registered for its action. Downstream messages staged by the handler are enqueued
 * before the message is acknowledged; any failure leaves the lease to expire.
 *
 * <p>Example:
 * <pre>
 * Worker worker = Worker.builder()
 *     .queueRegistry(queues)
 *     .queueName("nlp-queue")
 *     .actionRegistry(registry)
 *     .concurrency(2)
 *     .build();
 *
 * worker.start();
 * // ... later
 * worker.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface Worker {

    /**
     * Start polling the queue in the background.
     */
    void start();

    /**
     * Stop the worker gracefully.
     *
     * <p>Stops receiving new messages and waits for in-flight messages to finish
     * within the timeout. Unfinished leases simply expire.
     *
     * @param timeout Maximum time to wait for in-flight messages
     * @return Future that completes when the worker has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop the worker immediately without waiting.
     */
    void stopNow();

    /**
     * Run one pass of the lease state machine on the calling thread.
     *
     * @return {@link LeaseState#IDLE} if nothing was received, otherwise
     *         {@link LeaseState#COMMITTED} or {@link LeaseState#FAILED}
     * @throws com.ivamare.pipeline.exception.QueueUnavailableException if the queue cannot be read
     */
    LeaseState processNext();

    /**
     * @return true if the worker is accepting and processing messages
     */
    boolean isRunning();

    /**
     * @return count of messages currently being processed
     */
    int inFlightCount();

    /**
     * @return worker name, used in logs, metrics and health details
     */
    String name();

    /**
     * @return the queue this worker consumes
     */
    String queueName();

    /**
     * Consecutive infrastructure errors since the last successful poll.
     *
     * @return error count
     */
    int getConsecutiveErrorCount();

    static WorkerBuilder builder() {
        return new WorkerBuilder();
    }
}
