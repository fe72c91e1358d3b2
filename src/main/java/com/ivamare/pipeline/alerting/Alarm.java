package com.ivamare.pipeline.alerting;

import java.time.Instant;
import java.util.Optional;

/**
 * Two-state alarm with transition-only notification.
 *
 * <p>A breach while already in ALARM is silent, as is the return to OK. The next
 * notification needs a return to OK followed by a new breach.
 */
public class Alarm {

    private final AlarmDefinition definition;
    private AlarmState state = AlarmState.OK;
    private Instant stateChangedAt;
    private double lastValue;

    public Alarm(AlarmDefinition definition) {
        this.definition = definition;
    }

    /**
     * Evaluate the alarm against a freshly computed aggregate.
     *
     * @param aggregate windowed Sum of the metric
     * @param now evaluation time
     * @return a notification on {@code OK -> ALARM}, empty otherwise
     */
    public synchronized Optional<AlarmNotification> evaluate(double aggregate, Instant now) {
        lastValue = aggregate;
        boolean breached = definition.comparison().breaches(aggregate, definition.threshold());

        if (breached && state == AlarmState.OK) {
            state = AlarmState.ALARM;
            stateChangedAt = now;
            return Optional.of(new AlarmNotification(
                definition.name(), definition.metric(), definition.description(),
                aggregate, definition.threshold(), definition.comparison(), now));
        }
        if (!breached && state == AlarmState.ALARM) {
            state = AlarmState.OK;
            stateChangedAt = now;
        }
        return Optional.empty();
    }

    public AlarmDefinition definition() {
        return definition;
    }

    public synchronized AlarmState state() {
        return state;
    }

    /**
     * @return time of the last transition, null if never transitioned
     */
    public synchronized Instant stateChangedAt() {
        return stateChangedAt;
    }

    public synchronized double lastValue() {
        return lastValue;
    }
}
