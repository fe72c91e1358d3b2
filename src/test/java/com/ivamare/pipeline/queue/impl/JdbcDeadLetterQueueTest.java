package com.ivamare.pipeline.queue.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pipeline.MutableClock;
import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.queue.DeadLetterListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcDeadLetterQueue")
class JdbcDeadLetterQueueTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private DeadLetterListener listener;

    private JdbcDeadLetterQueue dlq;

    @BeforeEach
    void setUp() {
        dlq = new JdbcDeadLetterQueue("nlp-queue_dlq", "nlp-queue", Duration.ofDays(14),
            jdbcTemplate, new ObjectMapper(), new MutableClock(NOW));
        dlq.addListener(listener);
    }

    private DeadLetterEntry entry() {
        return new DeadLetterEntry("nlp-queue", "12", Map.of("action", "e_event_extractor"), 2,
            NOW.minusSeconds(1800), NOW);
    }

    private void stubInsert(int rows) {
        when(jdbcTemplate.update(startsWith("INSERT INTO pipeline.dead_letter"),
            any(), any(), any(), any(), any(), any())).thenReturn(rows);
    }

    @Test
    @DisplayName("should insert entry and notify listeners outside a transaction")
    void shouldInsertAndNotify() {
        stubInsert(1);

        assertTrue(dlq.relocate(entry()));

        verify(jdbcTemplate).update(contains("ON CONFLICT (source_queue, message_id) DO NOTHING"),
            eq("nlp-queue"), eq("12"), eq("{\"action\":\"e_event_extractor\"}"), eq(2),
            eq(Timestamp.from(NOW.minusSeconds(1800))), eq(Timestamp.from(NOW)));
        verify(listener).onDeadLetter(entry());
    }

    @Test
    @DisplayName("should not notify when the entry already exists")
    void shouldIgnoreDuplicate() {
        stubInsert(0);

        assertFalse(dlq.relocate(entry()));

        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("should defer listeners until the surrounding transaction commits")
    void shouldNotifyAfterCommit() {
        stubInsert(1);
        TransactionSynchronizationManager.initSynchronization();
        try {
            dlq.relocate(entry());
            verifyNoInteractions(listener);

            for (TransactionSynchronization sync : TransactionSynchronizationManager.getSynchronizations()) {
                sync.afterCommit();
            }
            verify(listener).onDeadLetter(entry());
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("should count entries of its own source queue")
    void shouldCountEntries() {
        when(jdbcTemplate.queryForObject("SELECT count(*) FROM pipeline.dead_letter WHERE source_queue = ?",
            Long.class, "nlp-queue")).thenReturn(3L);

        assertEquals(3L, dlq.size());
    }

    @Test
    @DisplayName("should purge entries older than the retention cutoff")
    void shouldPurgeByCutoff() {
        when(jdbcTemplate.update(
            "DELETE FROM pipeline.dead_letter WHERE source_queue = ? AND dead_lettered_at < ?",
            "nlp-queue", Timestamp.from(NOW.minus(Duration.ofDays(14))))).thenReturn(4);

        assertEquals(4, dlq.purgeExpired());
    }
}
