package com.ivamare.pipeline.alerting;

import java.time.Instant;

/**
 * Sent to notification channels when an alarm goes from OK to ALARM.
 *
 * @param alarmName Alarm name
 * @param metric Metric that breached
 * @param description Alarm description
 * @param value Windowed Sum at evaluation time
 * @param threshold Alarm threshold
 * @param comparison Comparison operator
 * @param transitionedAt Evaluation time of the transition
 */
public record AlarmNotification(
    String alarmName,
    String metric,
    String description,
    double value,
    double threshold,
    ComparisonOperator comparison,
    Instant transitionedAt
) {
    public String summary() {
        return String.format("%s: %s = %.0f %s %.0f (%s)",
            alarmName, metric, value, comparison.symbol(), threshold, description);
    }
}
