package com.ivamare.pipeline.queue.impl;

import com.ivamare.pipeline.exception.InvalidOperationException;
import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.queue.DeadLetterOperations;
import com.ivamare.pipeline.queue.DeadLetterQueue;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default implementation of DeadLetterOperations over the registered queues.
 */
public class DefaultDeadLetterOperations implements DeadLetterOperations {

    private static final Logger log = LoggerFactory.getLogger(DefaultDeadLetterOperations.class);

    private final QueueRegistry queueRegistry;

    public DefaultDeadLetterOperations(QueueRegistry queueRegistry) {
        this.queueRegistry = queueRegistry;
    }

    @Override
    public List<DeadLetterEntry> list(String queueName, int limit, int offset) {
        return dlq(queueName).list(limit, offset);
    }

    @Override
    public long count(String queueName) {
        return dlq(queueName).size();
    }

    @Override
    public String replay(String queueName, String messageId, String operator) {
        MessageQueue queue = queueRegistry.get(queueName);
        DeadLetterQueue dlq = queue.deadLetterQueue();
        DeadLetterEntry entry = dlq.get(messageId)
            .orElseThrow(() -> notDeadLettered(queueName, messageId));

        String newId = queue.enqueue(entry.payload());
        dlq.remove(messageId);

        log.info("Replayed dead-lettered message {} on {} as {} (operator={})",
            messageId, queueName, newId, operator);
        return newId;
    }

    @Override
    public void discard(String queueName, String messageId, String operator) {
        if (!dlq(queueName).remove(messageId)) {
            throw notDeadLettered(queueName, messageId);
        }
        log.info("Discarded dead-lettered message {} from {} (operator={})", messageId, queueName, operator);
    }

    @Override
    public int purgeExpired() {
        int purged = 0;
        for (MessageQueue queue : queueRegistry.all()) {
            purged += queue.deadLetterQueue().purgeExpired();
        }
        return purged;
    }

    private DeadLetterQueue dlq(String queueName) {
        return queueRegistry.get(queueName).deadLetterQueue();
    }

    private static InvalidOperationException notDeadLettered(String queueName, String messageId) {
        return new InvalidOperationException(
            "Message " + messageId + " is not in the dead-letter queue of " + queueName);
    }
}
