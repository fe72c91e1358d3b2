package com.ivamare.pipeline.queue;

import com.ivamare.pipeline.model.DeadLetterEntry;

import java.util.List;

/**
 * Operator actions on dead-lettered messages.
 *
 * <p>Dead-lettering itself is automatic; getting a message out again is always a
 * manual decision.
 *
 * <p>Example:
 * <pre>
 * List&lt;DeadLetterEntry&gt; poisoned = ops.list("nlp-queue", 50, 0);
 *
 * // after fixing the cause
 * String newId = ops.replay("nlp-queue", poisoned.get(0).messageId(), "alice");
 *
 * // or drop it
 * ops.discard("nlp-queue", messageId, "alice");
 * </pre>
 */
public interface DeadLetterOperations {

    /**
     * List dead-lettered messages of a source queue, newest first.
     *
     * @param queueName source queue
     * @param limit maximum items
     * @param offset items to skip
     * @return entries
     */
    List<DeadLetterEntry> list(String queueName, int limit, int offset);

    /**
     * Count dead-lettered messages of a source queue.
     *
     * @param queueName source queue
     * @return count
     */
    long count(String queueName);

    /**
     * Re-inject a dead-lettered message into its source queue.
     *
     * <p>The payload is enqueued as a new message (new ID, delivery count zero) before
     * the dead-letter entry is removed, so a failed enqueue leaves the entry in place.
     *
     * @param queueName source queue
     * @param messageId original message ID
     * @param operator operator identity for the log (nullable)
     * @return ID of the new message
     * @throws com.ivamare.pipeline.exception.InvalidOperationException if not dead-lettered
     */
    String replay(String queueName, String messageId, String operator);

    /**
     * Drop a dead-lettered message.
     *
     * @param queueName source queue
     * @param messageId original message ID
     * @param operator operator identity for the log (nullable)
     * @throws com.ivamare.pipeline.exception.InvalidOperationException if not dead-lettered
     */
    void discard(String queueName, String messageId, String operator);

    /**
     * Drop entries older than the retention window from every dead-letter queue.
     *
     * @return number of entries dropped
     */
    int purgeExpired();
}
