package com.ivamare.pipeline.queue;

import com.ivamare.pipeline.model.DeadLetterEntry;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store for messages that exhausted their receive budget.
 *
 * <p>Entries are never redelivered automatically. They expire after the retention
 * window, or leave through an explicit operator action.
 */
public interface DeadLetterQueue {

    /**
     * Name of this dead-letter queue, e.g. {@code scraper-queue_dlq}.
     *
     * @return queue name
     */
    String name();

    /**
     * Store a relocated message. Relocating the same message twice is a no-op.
     *
     * @param entry the relocated message
     * @return true if the entry was new
     */
    boolean relocate(DeadLetterEntry entry);

    /**
     * Look up an entry by its original message ID.
     *
     * @param messageId original message ID
     * @return the entry, if present
     */
    Optional<DeadLetterEntry> get(String messageId);

    /**
     * List entries, newest first.
     *
     * @param limit maximum number of entries
     * @param offset number of entries to skip
     * @return entries
     */
    List<DeadLetterEntry> list(int limit, int offset);

    /**
     * Number of entries currently held.
     *
     * @return count
     */
    long size();

    /**
     * Remove an entry (operator discard or replay).
     *
     * @param messageId original message ID
     * @return true if an entry was removed
     */
    boolean remove(String messageId);

    /**
     * Drop entries older than the retention window.
     *
     * @return number of entries dropped
     */
    int purgeExpired();

    /**
     * Register a listener for new arrivals.
     *
     * @param listener the listener
     */
    void addListener(DeadLetterListener listener);
}
