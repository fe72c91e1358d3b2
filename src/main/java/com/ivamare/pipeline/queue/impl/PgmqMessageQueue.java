package com.ivamare.pipeline.queue.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pipeline.exception.QueueUnavailableException;
import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.model.QueueMessage;
import com.ivamare.pipeline.model.QueueStats;
import com.ivamare.pipeline.queue.DeadLetterQueue;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MessageQueue on top of the PGMQ Postgres extension.
 *
 * <p>PGMQ's {@code read_ct} is the delivery count. The receipt handle is
 * {@code msgId:readCount}; acknowledge and visibility changes only match the row while
 * its {@code read_ct} is unchanged, so a receipt from an earlier delivery is stale.
 *
 * <p>A row read with {@code read_ct > maxReceiveCount} is relocated to the dead-letter
 * queue and deleted in one transaction.
 */
public class PgmqMessageQueue implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(PgmqMessageQueue.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int POLL_INTERVAL_MS = 250;

    /** Field holding a body that is not a JSON object, so it can still be leased and dead-lettered. */
    static final String RAW_BODY_FIELD = "raw";

    private final String name;
    private final String pgmqName;
    private final String table;
    private final QueueSettings settings;
    private final DeadLetterQueue deadLetterQueue;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PgmqMessageQueue(String name,
                            QueueSettings settings,
                            DeadLetterQueue deadLetterQueue,
                            JdbcTemplate jdbcTemplate,
                            TransactionTemplate transactionTemplate,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.name = name;
        this.pgmqName = QueueNames.pgmqName(name);
        this.table = QueueNames.pgmqTable(name);
        this.settings = settings;
        this.deadLetterQueue = deadLetterQueue;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Create the PGMQ queue if it does not exist yet.
     */
    public void createQueue() {
        jdbcTemplate.execute("SELECT pgmq.create('" + pgmqName + "')");
        log.info("Ensured PGMQ queue {} for {}", pgmqName, name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String enqueue(Map<String, Object> payload) {
        String json = toJson(payload);
        Long msgId;
        try {
            msgId = jdbcTemplate.queryForObject(
                "SELECT pgmq.send(?, ?::jsonb, ?)",
                Long.class,
                pgmqName, json, 0
            );
        } catch (DataAccessException e) {
            throw new QueueUnavailableException(name, "send failed", e);
        }
        if (msgId == null) {
            throw new QueueUnavailableException(name, "send returned no message id", null);
        }
        log.debug("Sent message to {}: msgId={}", name, msgId);
        return String.valueOf(msgId);
    }

    @Override
    public List<QueueMessage> receive(int maxBatch, Duration waitTimeout) {
        if (maxBatch < 1) {
            throw new IllegalArgumentException("maxBatch must be at least 1");
        }
        int waitSeconds = waitTimeout != null ? (int) waitTimeout.toSeconds() : 0;
        List<QueueMessage> leased = new ArrayList<>(maxBatch);

        try {
            List<PgmqRow> rows = read(maxBatch, waitSeconds);
            while (!rows.isEmpty()) {
                boolean relocated = false;
                for (PgmqRow row : rows) {
                    if (row.readCount > settings.maxReceiveCount()) {
                        relocate(row);
                        relocated = true;
                    } else {
                        leased.add(row.toQueueMessage());
                    }
                }
                // Relocated rows used up part of the batch; try to fill it without waiting.
                if (!relocated || leased.size() >= maxBatch) {
                    break;
                }
                rows = read(maxBatch - leased.size(), 0);
            }
        } catch (DataAccessException e) {
            throw new QueueUnavailableException(name, "read failed", e);
        }
        return leased;
    }

    @Override
    public boolean acknowledge(String receiptHandle) {
        Receipt receipt = Receipt.parse(receiptHandle);
        if (receipt == null) {
            log.warn("Malformed receipt handle on {}: {}", name, receiptHandle);
            return false;
        }
        try {
            int deleted = jdbcTemplate.update(
                "DELETE FROM " + table + " WHERE msg_id = ? AND read_ct = ?",
                receipt.msgId, receipt.readCount
            );
            return deleted > 0;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException(name, "delete failed", e);
        }
    }

    @Override
    public boolean changeVisibility(String receiptHandle, Duration timeout) {
        Receipt receipt = Receipt.parse(receiptHandle);
        if (receipt == null) {
            return false;
        }
        try {
            int updated = jdbcTemplate.update(
                "UPDATE " + table + " SET vt = clock_timestamp() + make_interval(secs => ?)"
                    + " WHERE msg_id = ? AND read_ct = ?",
                timeout.toSeconds(), receipt.msgId, receipt.readCount
            );
            return updated > 0;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException(name, "set_vt failed", e);
        }
    }

    @Override
    public QueueStats stats() {
        try {
            return jdbcTemplate.queryForObject(
                "SELECT count(*) FILTER (WHERE vt <= clock_timestamp()) AS visible,"
                    + " count(*) FILTER (WHERE vt > clock_timestamp()) AS in_flight"
                    + " FROM " + table,
                (rs, rowNum) -> new QueueStats(name, rs.getLong("visible"), rs.getLong("in_flight"),
                    deadLetterQueue.size())
            );
        } catch (DataAccessException e) {
            throw new QueueUnavailableException(name, "stats query failed", e);
        }
    }

    @Override
    public DeadLetterQueue deadLetterQueue() {
        return deadLetterQueue;
    }

    @Override
    public QueueSettings settings() {
        return settings;
    }

    // --- Helper Methods ---

    private List<PgmqRow> read(int batchSize, int waitSeconds) {
        if (waitSeconds > 0) {
            return jdbcTemplate.query(
                "SELECT * FROM pgmq.read_with_poll(?, ?, ?, ?, ?)",
                this::mapRow,
                pgmqName, settings.visibilityTimeoutSeconds(), batchSize, waitSeconds, POLL_INTERVAL_MS
            );
        }
        return jdbcTemplate.query(
            "SELECT * FROM pgmq.read(?, ?, ?)",
            this::mapRow,
            pgmqName, settings.visibilityTimeoutSeconds(), batchSize
        );
    }

    private void relocate(PgmqRow row) {
        // read_ct already counts the read that found the message exhausted
        int delivered = row.readCount - 1;
        DeadLetterEntry entry = new DeadLetterEntry(
            name, String.valueOf(row.msgId), row.payload, delivered, row.enqueuedAt, clock.instant());
        transactionTemplate.executeWithoutResult(status -> {
            deadLetterQueue.relocate(entry);
            jdbcTemplate.queryForObject("SELECT pgmq.delete(?, ?)", Boolean.class, pgmqName, row.msgId);
        });
    }

    private PgmqRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp enqueuedAt = rs.getTimestamp("enqueued_at");
        Timestamp vt = rs.getTimestamp("vt");
        return new PgmqRow(
            rs.getLong("msg_id"),
            rs.getInt("read_ct"),
            enqueuedAt != null ? enqueuedAt.toInstant() : null,
            vt != null ? vt.toInstant() : null,
            fromJson(rs.getString("message"))
        );
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message payload is not serializable to JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node != null && node.isObject()) {
                return objectMapper.convertValue(node, MAP_TYPE);
            }
            log.warn("Message body on {} is not a JSON object, keeping it raw", name);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable message body on {}, keeping it raw: {}", name, e.getOriginalMessage());
        }
        return Map.of(RAW_BODY_FIELD, json);
    }

    private record PgmqRow(long msgId, int readCount, Instant enqueuedAt, Instant vt, Map<String, Object> payload) {

        QueueMessage toQueueMessage() {
            return new QueueMessage(String.valueOf(msgId), msgId + ":" + readCount, payload, readCount, enqueuedAt, vt);
        }
    }

    private record Receipt(long msgId, int readCount) {

        static Receipt parse(String receiptHandle) {
            if (receiptHandle == null) {
                return null;
            }
            int sep = receiptHandle.indexOf(':');
            if (sep <= 0) {
                return null;
            }
            try {
                return new Receipt(
                    Long.parseLong(receiptHandle.substring(0, sep)),
                    Integer.parseInt(receiptHandle.substring(sep + 1)));
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
