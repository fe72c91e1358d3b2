package com.ivamare.pipeline.scheduler.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pipeline.scheduler.ScheduleExpression;
import com.ivamare.pipeline.scheduler.ScheduleRule;
import com.ivamare.pipeline.scheduler.ScheduleRuleStore;
import com.ivamare.pipeline.scheduler.StoredRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Rule store in {@code pipeline.schedule_rule}, shared by every instance on the database.
 *
 * <p>Rules survive restarts. A fire is claimed with a conditional update of
 * {@code next_fire}; the row lock makes concurrent claims of the same fire serialize,
 * and only the first one still sees the rule as due.
 */
public class JdbcScheduleRuleStore implements ScheduleRuleStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleRuleStore.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = "name, schedule, target_queue, payload, next_fire";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcScheduleRuleStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Create the rule table if missing.
     */
    public void createTable() {
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS pipeline");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline.schedule_rule (
                name         TEXT        PRIMARY KEY,
                schedule     TEXT        NOT NULL,
                target_queue TEXT        NOT NULL,
                payload      JSONB       NOT NULL,
                next_fire    TIMESTAMPTZ NOT NULL
            )""");
    }

    @Override
    public boolean insert(ScheduleRule rule, Instant nextFire) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO pipeline.schedule_rule (" + COLUMNS + ")"
                + " VALUES (?, ?, ?, ?::jsonb, ?)"
                + " ON CONFLICT (name) DO NOTHING",
            rule.name(),
            rule.schedule().expression(),
            rule.targetQueue(),
            toJson(rule.payload()),
            Timestamp.from(nextFire)
        );
        return inserted > 0;
    }

    @Override
    public void save(ScheduleRule rule, Instant nextFire) {
        jdbcTemplate.update(
            "INSERT INTO pipeline.schedule_rule (" + COLUMNS + ")"
                + " VALUES (?, ?, ?, ?::jsonb, ?)"
                + " ON CONFLICT (name) DO UPDATE SET"
                + " schedule = EXCLUDED.schedule,"
                + " target_queue = EXCLUDED.target_queue,"
                + " payload = EXCLUDED.payload,"
                + " next_fire = CASE WHEN schedule_rule.schedule = EXCLUDED.schedule"
                + " THEN schedule_rule.next_fire ELSE EXCLUDED.next_fire END",
            rule.name(),
            rule.schedule().expression(),
            rule.targetQueue(),
            toJson(rule.payload()),
            Timestamp.from(nextFire)
        );
    }

    @Override
    public boolean delete(String name) {
        return jdbcTemplate.update("DELETE FROM pipeline.schedule_rule WHERE name = ?", name) > 0;
    }

    @Override
    public boolean contains(String name) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT count(*) FROM pipeline.schedule_rule WHERE name = ?", Long.class, name);
        return count != null && count > 0;
    }

    @Override
    public List<StoredRule> findAll() {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM pipeline.schedule_rule ORDER BY name",
            this::mapRow
        );
    }

    @Override
    public List<StoredRule> findDue(Instant now) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM pipeline.schedule_rule WHERE next_fire <= ? ORDER BY next_fire, name",
            this::mapRow,
            Timestamp.from(now)
        );
    }

    @Override
    public boolean claim(String name, Instant now, Instant nextFire) {
        int claimed = jdbcTemplate.update(
            "UPDATE pipeline.schedule_rule SET next_fire = ? WHERE name = ? AND next_fire <= ?",
            Timestamp.from(nextFire), name, Timestamp.from(now)
        );
        if (claimed == 0) {
            log.debug("Fire of schedule rule {} at {} already claimed", name, now);
        }
        return claimed > 0;
    }

    private StoredRule mapRow(ResultSet rs, int rowNum) throws SQLException {
        ScheduleRule rule = new ScheduleRule(
            rs.getString("name"),
            ScheduleExpression.parse(rs.getString("schedule")),
            rs.getString("target_queue"),
            fromJson(rs.getString("payload"))
        );
        return new StoredRule(rule, rs.getTimestamp("next_fire").toInstant());
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schedule rule payload is not serializable to JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable schedule rule payload", e);
        }
    }
}
