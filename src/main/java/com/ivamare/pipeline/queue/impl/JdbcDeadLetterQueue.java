package com.ivamare.pipeline.queue.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.queue.DeadLetterListener;
import com.ivamare.pipeline.queue.DeadLetterQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dead-letter queue stored in {@code pipeline.dead_letter}, one row per relocated message.
 *
 * <p>The primary key {@code (source_queue, message_id)} makes relocation idempotent.
 * Listeners run after the surrounding transaction commits.
 */
public class JdbcDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeadLetterQueue.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
        "source_queue, message_id, payload, delivery_count, enqueued_at, dead_lettered_at";

    private final String name;
    private final String sourceQueue;
    private final Duration retention;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final List<DeadLetterListener> listeners = new CopyOnWriteArrayList<>();

    public JdbcDeadLetterQueue(String name,
                               String sourceQueue,
                               Duration retention,
                               JdbcTemplate jdbcTemplate,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.name = name;
        this.sourceQueue = sourceQueue;
        this.retention = retention;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Create the dead-letter table if missing. Shared by all queues.
     */
    public void createTable() {
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS pipeline");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline.dead_letter (
                source_queue     TEXT        NOT NULL,
                message_id       TEXT        NOT NULL,
                payload          JSONB       NOT NULL,
                delivery_count   INTEGER     NOT NULL,
                enqueued_at      TIMESTAMPTZ,
                dead_lettered_at TIMESTAMPTZ NOT NULL,
                PRIMARY KEY (source_queue, message_id)
            )""");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean relocate(DeadLetterEntry entry) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO pipeline.dead_letter (" + COLUMNS + ")"
                + " VALUES (?, ?, ?::jsonb, ?, ?, ?)"
                + " ON CONFLICT (source_queue, message_id) DO NOTHING",
            sourceQueue,
            entry.messageId(),
            toJson(entry.payload()),
            entry.deliveryCount(),
            entry.enqueuedAt() != null ? Timestamp.from(entry.enqueuedAt()) : null,
            Timestamp.from(entry.deadLetteredAt())
        );
        if (inserted == 0) {
            log.debug("Message {} already in {}, ignoring relocation", entry.messageId(), name);
            return false;
        }

        log.warn("Message {} moved to {} after {} deliveries", entry.messageId(), name, entry.deliveryCount());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    InMemoryDeadLetterQueue.notifyListeners(listeners, entry);
                }
            });
        } else {
            InMemoryDeadLetterQueue.notifyListeners(listeners, entry);
        }
        return true;
    }

    @Override
    public Optional<DeadLetterEntry> get(String messageId) {
        List<DeadLetterEntry> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM pipeline.dead_letter WHERE source_queue = ? AND message_id = ?",
            this::mapRow,
            sourceQueue, messageId
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<DeadLetterEntry> list(int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM pipeline.dead_letter WHERE source_queue = ?"
                + " ORDER BY dead_lettered_at DESC, message_id DESC LIMIT ? OFFSET ?",
            this::mapRow,
            sourceQueue, limit, offset
        );
    }

    @Override
    public long size() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT count(*) FROM pipeline.dead_letter WHERE source_queue = ?",
            Long.class,
            sourceQueue
        );
        return count != null ? count : 0L;
    }

    @Override
    public boolean remove(String messageId) {
        return jdbcTemplate.update(
            "DELETE FROM pipeline.dead_letter WHERE source_queue = ? AND message_id = ?",
            sourceQueue, messageId
        ) > 0;
    }

    @Override
    public int purgeExpired() {
        int purged = jdbcTemplate.update(
            "DELETE FROM pipeline.dead_letter WHERE source_queue = ? AND dead_lettered_at < ?",
            sourceQueue, Timestamp.from(clock.instant().minus(retention))
        );
        if (purged > 0) {
            log.info("Purged {} expired entries from {}", purged, name);
        }
        return purged;
    }

    @Override
    public void addListener(DeadLetterListener listener) {
        listeners.add(listener);
    }

    private DeadLetterEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp enqueuedAt = rs.getTimestamp("enqueued_at");
        return new DeadLetterEntry(
            rs.getString("source_queue"),
            rs.getString("message_id"),
            fromJson(rs.getString("payload")),
            rs.getInt("delivery_count"),
            enqueuedAt != null ? enqueuedAt.toInstant() : null,
            rs.getTimestamp("dead_lettered_at").toInstant()
        );
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Dead-letter payload is not serializable to JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable dead-letter payload in " + name, e);
        }
    }
}
