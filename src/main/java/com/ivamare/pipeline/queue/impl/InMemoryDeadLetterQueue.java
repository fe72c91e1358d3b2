package com.ivamare.pipeline.queue.impl;

import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.queue.DeadLetterListener;
import com.ivamare.pipeline.queue.DeadLetterQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dead-letter queue held in memory, keyed by original message ID.
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterQueue.class);

    private final String name;
    private final Duration retention;
    private final Clock clock;
    private final Map<String, DeadLetterEntry> entries = new LinkedHashMap<>();
    private final List<DeadLetterListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryDeadLetterQueue(String name, Duration retention, Clock clock) {
        this.name = name;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean relocate(DeadLetterEntry entry) {
        synchronized (entries) {
            if (entries.putIfAbsent(entry.messageId(), entry) != null) {
                log.debug("Message {} already in {}, ignoring relocation", entry.messageId(), name);
                return false;
            }
        }
        log.warn("Message {} moved to {} after {} deliveries",
            entry.messageId(), name, entry.deliveryCount());
        notifyListeners(listeners, entry);
        return true;
    }

    @Override
    public Optional<DeadLetterEntry> get(String messageId) {
        synchronized (entries) {
            return Optional.ofNullable(entries.get(messageId));
        }
    }

    @Override
    public List<DeadLetterEntry> list(int limit, int offset) {
        List<DeadLetterEntry> newestFirst;
        synchronized (entries) {
            newestFirst = new ArrayList<>(entries.values());
        }
        Collections.reverse(newestFirst);
        return newestFirst.stream().skip(offset).limit(limit).toList();
    }

    @Override
    public long size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    @Override
    public boolean remove(String messageId) {
        synchronized (entries) {
            return entries.remove(messageId) != null;
        }
    }

    @Override
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int purged = 0;
        synchronized (entries) {
            Iterator<DeadLetterEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().deadLetteredAt().isBefore(cutoff)) {
                    it.remove();
                    purged++;
                }
            }
        }
        if (purged > 0) {
            log.info("Purged {} expired entries from {}", purged, name);
        }
        return purged;
    }

    @Override
    public void addListener(DeadLetterListener listener) {
        listeners.add(listener);
    }

    static void notifyListeners(List<DeadLetterListener> listeners, DeadLetterEntry entry) {
        for (DeadLetterListener listener : listeners) {
            try {
                listener.onDeadLetter(entry);
            } catch (RuntimeException e) {
                log.warn("Dead-letter listener failed for message {}: {}", entry.messageId(), e.getMessage());
            }
        }
    }
}
