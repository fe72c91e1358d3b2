package com.ivamare.pipeline.queue;

import com.ivamare.pipeline.exception.QueueNotFoundException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of the queues known to this process by logical name.
 */
public class QueueRegistry {

    private final Map<String, MessageQueue> queues = new LinkedHashMap<>();

    public QueueRegistry(Collection<? extends MessageQueue> queues) {
        for (MessageQueue queue : queues) {
            if (this.queues.putIfAbsent(queue.name(), queue) != null) {
                throw new IllegalArgumentException("Duplicate queue name: " + queue.name());
            }
        }
    }

    public Optional<MessageQueue> find(String queueName) {
        return Optional.ofNullable(queues.get(queueName));
    }

    /**
     * Get a queue, throwing if it is not registered.
     *
     * @param queueName logical queue name
     * @return the queue
     * @throws QueueNotFoundException if not registered
     */
    public MessageQueue get(String queueName) {
        return find(queueName).orElseThrow(() -> new QueueNotFoundException(queueName));
    }

    public boolean contains(String queueName) {
        return queues.containsKey(queueName);
    }

    public Collection<MessageQueue> all() {
        return Collections.unmodifiableCollection(queues.values());
    }
}
