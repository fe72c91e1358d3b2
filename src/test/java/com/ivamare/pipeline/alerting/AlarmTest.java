package com.ivamare.pipeline.alerting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Alarm")
class AlarmTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final Alarm alarm = new Alarm(new AlarmDefinition(
        "TotalRequeryErrorAlarm", LogPatternFilter.TOTAL_REQUERY_ERROR, 1, Duration.ofHours(20),
        ComparisonOperator.GREATER_THAN_OR_EQUAL, "Batch results could not be stored"));

    @Test
    @DisplayName("should start in OK without a transition time")
    void shouldStartOk() {
        assertEquals(AlarmState.OK, alarm.state());
        assertNull(alarm.stateChangedAt());
    }

    @Test
    @DisplayName("should notify on OK to ALARM with the breaching value")
    void shouldNotifyOnBreach() {
        Optional<AlarmNotification> notification = alarm.evaluate(2, T0);

        assertTrue(notification.isPresent());
        assertEquals(AlarmState.ALARM, alarm.state());
        assertEquals(T0, alarm.stateChangedAt());
        assertEquals(2.0, notification.get().value());
        assertEquals(T0, notification.get().transitionedAt());
        assertEquals("TotalRequeryErrorAlarm: TotalRequeryError = 2 >= 1 (Batch results could not be stored)",
            notification.get().summary());
    }

    @Test
    @DisplayName("should stay silent while breached and on recovery")
    void shouldStaySilent() {
        alarm.evaluate(1, T0);

        assertTrue(alarm.evaluate(4, T0.plusSeconds(60)).isEmpty());
        assertTrue(alarm.evaluate(0, T0.plusSeconds(120)).isEmpty());
        assertEquals(AlarmState.OK, alarm.state());
        assertTrue(alarm.evaluate(1, T0.plusSeconds(180)).isPresent());
    }

    @Test
    @DisplayName("comparison operators should compare against the threshold")
    void comparisonOperators() {
        assertTrue(ComparisonOperator.GREATER_THAN_OR_EQUAL.breaches(1, 1));
        assertFalse(ComparisonOperator.GREATER_THAN.breaches(1, 1));
        assertTrue(ComparisonOperator.LESS_THAN.breaches(0, 1));
        assertTrue(ComparisonOperator.LESS_THAN_OR_EQUAL.breaches(1, 1));
    }

    @Test
    @DisplayName("definition should require a positive window")
    void shouldRequirePositiveWindow() {
        assertThrows(IllegalArgumentException.class, () ->
            AlarmDefinition.anyOccurrence("a", "m", Duration.ZERO, "d"));
    }
}
