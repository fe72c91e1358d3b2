package com.ivamare.pipeline.queue.impl;

import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.model.QueueMessage;
import com.ivamare.pipeline.model.QueueStats;
import com.ivamare.pipeline.queue.DeadLetterQueue;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process queue with the same lease semantics as the PGMQ backend.
 *
 * <p>All state transitions (lease, acknowledge, dead-letter relocation) happen under
 * one lock. Lease expiry is a deadline compared against the injected {@link Clock}
 * on every receive, so tests drive redelivery by moving a fake clock.
 *
 * <p>Acknowledging with the receipt of an expired lease still succeeds as long as
 * nobody has leased the message again.
 */
public class InMemoryMessageQueue implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageQueue.class);

    /** Longest single wait while blocking in receive, so expiring leases are noticed. */
    private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final String name;
    private final QueueSettings settings;
    private final DeadLetterQueue deadLetterQueue;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition messageAvailable = lock.newCondition();
    private final Map<String, StoredMessage> messages = new LinkedHashMap<>();
    private final Map<String, String> receipts = new HashMap<>();

    public InMemoryMessageQueue(String name, QueueSettings settings, Clock clock) {
        this(name, settings,
            new InMemoryDeadLetterQueue(QueueNames.deadLetterQueue(name), settings.deadLetterRetention(), clock),
            clock);
    }

    public InMemoryMessageQueue(String name, QueueSettings settings, DeadLetterQueue deadLetterQueue, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.deadLetterQueue = Objects.requireNonNull(deadLetterQueue, "deadLetterQueue");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String enqueue(Map<String, Object> payload) {
        Objects.requireNonNull(payload, "payload");
        StoredMessage message = new StoredMessage(UUID.randomUUID().toString(), Collections.unmodifiableMap(new LinkedHashMap<>(payload)), clock.instant());
        lock.lock();
        try {
            messages.put(message.messageId, message);
            messageAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Enqueued message {} on {}", message.messageId, name);
        return message.messageId;
    }

    @Override
    public List<QueueMessage> receive(int maxBatch, Duration waitTimeout) {
        if (maxBatch < 1) {
            throw new IllegalArgumentException("maxBatch must be at least 1");
        }
        long remaining = waitTimeout != null ? waitTimeout.toNanos() : 0L;

        lock.lock();
        try {
            while (true) {
                List<QueueMessage> leased = leaseVisible(maxBatch);
                if (!leased.isEmpty() || remaining <= 0) {
                    return leased;
                }
                long slice = Math.min(remaining, MAX_WAIT_SLICE_NANOS);
                long left = messageAvailable.awaitNanos(slice);
                remaining -= slice - Math.max(left, 0L);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean acknowledge(String receiptHandle) {
        lock.lock();
        try {
            String messageId = receipts.remove(receiptHandle);
            if (messageId == null) {
                log.debug("Stale receipt handle on {}, acknowledge ignored", name);
                return false;
            }
            messages.remove(messageId);
            log.debug("Acknowledged message {} on {}", messageId, name);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean changeVisibility(String receiptHandle, Duration timeout) {
        lock.lock();
        try {
            String messageId = receipts.get(receiptHandle);
            if (messageId == null) {
                return false;
            }
            StoredMessage message = messages.get(messageId);
            message.visibleAt = clock.instant().plus(timeout);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStats stats() {
        Instant now = clock.instant();
        long visible = 0;
        long inFlight = 0;
        lock.lock();
        try {
            for (StoredMessage message : messages.values()) {
                if (message.isVisible(now)) {
                    visible++;
                } else {
                    inFlight++;
                }
            }
        } finally {
            lock.unlock();
        }
        return new QueueStats(name, visible, inFlight, deadLetterQueue.size());
    }

    @Override
    public DeadLetterQueue deadLetterQueue() {
        return deadLetterQueue;
    }

    @Override
    public QueueSettings settings() {
        return settings;
    }

    // Caller holds the lock.
    private List<QueueMessage> leaseVisible(int maxBatch) {
        Instant now = clock.instant();
        List<QueueMessage> leased = new ArrayList<>(maxBatch);
        Iterator<StoredMessage> it = messages.values().iterator();

        while (it.hasNext() && leased.size() < maxBatch) {
            StoredMessage message = it.next();
            if (!message.isVisible(now)) {
                continue;
            }
            if (message.deliveryCount >= settings.maxReceiveCount()) {
                it.remove();
                if (message.receiptHandle != null) {
                    receipts.remove(message.receiptHandle);
                }
                deadLetterQueue.relocate(new DeadLetterEntry(
                    name, message.messageId, message.payload,
                    message.deliveryCount, message.enqueuedAt, now));
                continue;
            }

            if (message.receiptHandle != null) {
                receipts.remove(message.receiptHandle);
            }
            message.deliveryCount++;
            message.receiptHandle = UUID.randomUUID().toString();
            message.visibleAt = now.plus(settings.visibilityTimeout());
            receipts.put(message.receiptHandle, message.messageId);

            leased.add(new QueueMessage(
                message.messageId, message.receiptHandle, message.payload,
                message.deliveryCount, message.enqueuedAt, message.visibleAt));
        }
        return leased;
    }

    private static final class StoredMessage {
        private final String messageId;
        private final Map<String, Object> payload;
        private final Instant enqueuedAt;
        private int deliveryCount;
        private Instant visibleAt;
        private String receiptHandle;

        private StoredMessage(String messageId, Map<String, Object> payload, Instant enqueuedAt) {
            this.messageId = messageId;
            this.payload = payload;
            this.enqueuedAt = enqueuedAt;
            this.visibleAt = enqueuedAt;
        }

        private boolean isVisible(Instant now) {
            return !visibleAt.isAfter(now);
        }
    }
}
