package com.ivamare.pipeline.queue.impl;

import com.ivamare.pipeline.MutableClock;
import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.queue.DeadLetterListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("InMemoryDeadLetterQueue")
class InMemoryDeadLetterQueueTest {

    private MutableClock clock;
    private InMemoryDeadLetterQueue dlq;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        dlq = new InMemoryDeadLetterQueue("nlp-queue_dlq", Duration.ofDays(14), clock);
    }

    private DeadLetterEntry entry(String messageId) {
        return new DeadLetterEntry("nlp-queue", messageId, Map.of("action", "e_event_extractor"),
            2, clock.instant().minusSeconds(1800), clock.instant());
    }

    @Test
    @DisplayName("should ignore a second relocation of the same message")
    void shouldBeIdempotent() {
        DeadLetterListener listener = mock(DeadLetterListener.class);
        dlq.addListener(listener);

        assertTrue(dlq.relocate(entry("m1")));
        assertFalse(dlq.relocate(entry("m1")));

        assertEquals(1, dlq.size());
        verify(listener, times(1)).onDeadLetter(any());
    }

    @Test
    @DisplayName("should list newest first with paging")
    void shouldListNewestFirst() {
        dlq.relocate(entry("m1"));
        clock.advance(Duration.ofMinutes(1));
        dlq.relocate(entry("m2"));
        clock.advance(Duration.ofMinutes(1));
        dlq.relocate(entry("m3"));

        assertThat(dlq.list(10, 0)).extracting(DeadLetterEntry::messageId).containsExactly("m3", "m2", "m1");
        assertThat(dlq.list(1, 1)).extracting(DeadLetterEntry::messageId).containsExactly("m2");
    }

    @Test
    @DisplayName("should keep notifying remaining listeners when one fails")
    void shouldIsolateListenerFailures() {
        DeadLetterListener failing = mock(DeadLetterListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onDeadLetter(any());
        DeadLetterListener healthy = mock(DeadLetterListener.class);
        dlq.addListener(failing);
        dlq.addListener(healthy);

        assertTrue(dlq.relocate(entry("m1")));

        verify(healthy).onDeadLetter(argThat(e -> e.messageId().equals("m1")));
    }

    @Test
    @DisplayName("should purge only entries older than the retention window")
    void shouldPurgeExpiredEntries() {
        dlq.relocate(entry("old"));
        clock.advance(Duration.ofDays(10));
        dlq.relocate(entry("recent"));
        clock.advance(Duration.ofDays(5));

        assertEquals(1, dlq.purgeExpired());

        assertTrue(dlq.get("old").isEmpty());
        assertTrue(dlq.get("recent").isPresent());
    }

    @Test
    @DisplayName("should remove entries on request")
    void shouldRemove() {
        dlq.relocate(entry("m1"));

        assertTrue(dlq.remove("m1"));
        assertFalse(dlq.remove("m1"));
        assertEquals(List.of(), dlq.list(10, 0));
    }
}
