package com.ivamare.pipeline.alerting;

import java.time.Duration;
import java.util.Objects;

/**
 * Static definition of an alarm on the windowed Sum of a metric.
 *
 * @param name Alarm name, unique per sink
 * @param metric Metric the alarm watches
 * @param threshold Threshold the Sum is compared to
 * @param evaluationWindow Window the Sum is taken over
 * @param comparison Comparison operator
 * @param description Human-readable text included in notifications
 */
public record AlarmDefinition(
    String name,
    String metric,
    double threshold,
    Duration evaluationWindow,
    ComparisonOperator comparison,
    String description
) {
    public AlarmDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(comparison, "comparison");
        if (evaluationWindow == null || evaluationWindow.isZero() || evaluationWindow.isNegative()) {
            throw new IllegalArgumentException("evaluationWindow must be positive");
        }
    }

    /**
     * Alarm that fires as soon as one occurrence is seen in the window.
     *
     * @param name Alarm name
     * @param metric Metric
     * @param window Evaluation window
     * @param description Description
     * @return the definition
     */
    public static AlarmDefinition anyOccurrence(String name, String metric, Duration window, String description) {
        return new AlarmDefinition(name, metric, 1, window, ComparisonOperator.GREATER_THAN_OR_EQUAL, description);
    }
}
