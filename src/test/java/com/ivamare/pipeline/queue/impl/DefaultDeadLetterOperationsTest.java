package com.ivamare.pipeline.queue.impl;

import com.ivamare.pipeline.MutableClock;
import com.ivamare.pipeline.exception.InvalidOperationException;
import com.ivamare.pipeline.exception.QueueNotFoundException;
import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.model.QueueMessage;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.queue.QueueSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultDeadLetterOperations")
class DefaultDeadLetterOperationsTest {

    private MutableClock clock;
    private InMemoryMessageQueue nlpQueue;
    private DefaultDeadLetterOperations operations;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        nlpQueue = new InMemoryMessageQueue(QueueNames.NLP_QUEUE, QueueSettings.nlpDefaults(), clock);
        InMemoryMessageQueue scraperQueue =
            new InMemoryMessageQueue(QueueNames.SCRAPER_QUEUE, QueueSettings.scraperDefaults(), clock);
        operations = new DefaultDeadLetterOperations(new QueueRegistry(List.of(scraperQueue, nlpQueue)));
    }

    private String poison(Map<String, Object> payload) {
        String id = nlpQueue.enqueue(payload);
        for (int i = 0; i < 3; i++) {
            nlpQueue.receive(1, Duration.ZERO);
            clock.advance(Duration.ofSeconds(901));
        }
        return id;
    }

    @Test
    @DisplayName("should list and count dead-lettered messages")
    void shouldListAndCount() {
        String id = poison(Map.of("action", "e_event_extractor"));

        assertEquals(1, operations.count(QueueNames.NLP_QUEUE));
        assertEquals(0, operations.count(QueueNames.SCRAPER_QUEUE));
        assertThat(operations.list(QueueNames.NLP_QUEUE, 10, 0))
            .extracting(DeadLetterEntry::messageId)
            .containsExactly(id);
    }

    @Test
    @DisplayName("should replay payload as a new message and remove the entry")
    void shouldReplay() {
        Map<String, Object> payload = Map.of("action", "e_event_extractor", "payload", Map.of("ids", List.of("b1")));
        String id = poison(payload);

        String newId = operations.replay(QueueNames.NLP_QUEUE, id, "alice");

        assertNotEquals(id, newId);
        assertEquals(0, operations.count(QueueNames.NLP_QUEUE));
        QueueMessage replayed = nlpQueue.receive(1, Duration.ZERO).get(0);
        assertEquals(newId, replayed.messageId());
        assertEquals(1, replayed.deliveryCount());
        assertEquals(payload, replayed.payload());
    }

    @Test
    @DisplayName("should reject replay of a message that is not dead-lettered")
    void shouldRejectReplayOfUnknownMessage() {
        assertThrows(InvalidOperationException.class,
            () -> operations.replay(QueueNames.NLP_QUEUE, "missing", "alice"));
    }

    @Test
    @DisplayName("should discard dead-lettered message")
    void shouldDiscard() {
        String id = poison(Map.of("action", "e_event_extractor"));

        operations.discard(QueueNames.NLP_QUEUE, id, "alice");

        assertEquals(0, operations.count(QueueNames.NLP_QUEUE));
        assertThrows(InvalidOperationException.class,
            () -> operations.discard(QueueNames.NLP_QUEUE, id, "alice"));
    }

    @Test
    @DisplayName("should purge expired entries across all queues")
    void shouldPurgeAcrossQueues() {
        poison(Map.of("action", "e_event_extractor"));
        clock.advance(Duration.ofDays(15));

        assertEquals(1, operations.purgeExpired());
        assertEquals(0, operations.count(QueueNames.NLP_QUEUE));
    }

    @Test
    @DisplayName("should throw for unknown queue")
    void shouldThrowForUnknownQueue() {
        assertThrows(QueueNotFoundException.class, () -> operations.count("no-such-queue"));
    }
}
