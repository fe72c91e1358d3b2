package com.ivamare.pipeline.queue;

import com.ivamare.pipeline.model.QueueMessage;
import com.ivamare.pipeline.model.QueueStats;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, at-least-once queue with visibility-timeout leasing and a dead-letter sink.
 *
 * <p>Contract:
 * <ul>
 *   <li>A received message is invisible to other consumers until its visibility
 *       deadline; after that it can be received again.</li>
 *   <li>Each delivery increments the delivery count. A message that has already been
 *       delivered {@code maxReceiveCount} times is moved to the dead-letter queue by
 *       the next {@code receive} instead of being returned.</li>
 *   <li>Lease expiry is evaluated on {@code receive}; there are no background timers.</li>
 *   <li>Nothing is exactly-once: consumers must tolerate duplicates.</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 * String id = queue.enqueue(Map.of("action", "e_ingest"));
 * for (QueueMessage m : queue.receive(1, Duration.ofSeconds(20))) {
 *     process(m);
 *     queue.acknowledge(m.receiptHandle());
 * }
 * </pre>
 */
public interface MessageQueue {

    /**
     * Logical queue name, e.g. {@code scraper-queue}.
     *
     * @return queue name
     */
    String name();

    /**
     * Enqueue a message. Either the whole message is stored or nothing is.
     *
     * @param payload message body
     * @return the new message ID
     * @throws com.ivamare.pipeline.exception.QueueUnavailableException if the backend rejects it
     */
    String enqueue(Map<String, Object> payload);

    /**
     * Lease up to {@code maxBatch} visible messages.
     *
     * <p>Blocks for at most {@code waitTimeout} when nothing is visible.
     *
     * @param maxBatch maximum messages to return
     * @param waitTimeout how long to wait for a message; zero returns immediately
     * @return leased messages, possibly empty
     */
    List<QueueMessage> receive(int maxBatch, Duration waitTimeout);

    /**
     * Lease a single message.
     *
     * @param waitTimeout how long to wait for a message
     * @return the leased message, if any
     */
    default Optional<QueueMessage> receiveOne(Duration waitTimeout) {
        List<QueueMessage> messages = receive(1, waitTimeout);
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(0));
    }

    /**
     * Remove a message permanently.
     *
     * <p>Returns false instead of throwing when the receipt handle is stale, i.e. the
     * lease expired and the message has been leased again (or acknowledged) since.
     *
     * @param receiptHandle receipt handle of the delivery being acknowledged
     * @return true if the message was removed
     */
    boolean acknowledge(String receiptHandle);

    /**
     * Move the visibility deadline of a current lease to now + {@code timeout}.
     *
     * @param receiptHandle receipt handle of the current delivery
     * @param timeout new visibility timeout measured from now
     * @return false if the receipt handle is stale
     */
    boolean changeVisibility(String receiptHandle, Duration timeout);

    /**
     * Current counts.
     *
     * @return queue statistics
     */
    QueueStats stats();

    /**
     * The dead-letter queue this queue relocates exhausted messages to.
     *
     * @return dead-letter queue
     */
    DeadLetterQueue deadLetterQueue();

    /**
     * Lease settings of this queue.
     *
     * @return settings
     */
    QueueSettings settings();
}
