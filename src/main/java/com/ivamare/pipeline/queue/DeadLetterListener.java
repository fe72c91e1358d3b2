package com.ivamare.pipeline.queue;

import com.ivamare.pipeline.model.DeadLetterEntry;

/**
 * Callback for messages arriving in a dead-letter queue.
 *
 * <p>Called once per message, on its first relocation only.
 */
@FunctionalInterface
public interface DeadLetterListener {

    void onDeadLetter(DeadLetterEntry entry);
}
