package com.ivamare.pipeline.alerting;

import java.util.List;

/**
 * Maps log lines containing a literal term to a metric.
 *
 * @param pattern Case-sensitive literal the formatted message must contain
 * @param metric Metric incremented per matching line
 */
public record LogPatternFilter(String pattern, String metric) {

    public static final String ERROR = "Error";
    public static final String TOTAL_REQUERY_ERROR = "TotalRequeryError";
    public static final String SCHEDULE_RULE_CREATION_ERROR = "ScheduleRuleCreationError";
    public static final String SCHEDULER_FAILURE = "SchedulerFailure";

    public boolean matches(String message) {
        return message != null && message.contains(pattern);
    }

    /**
     * The greppable error signals emitted by workers and the scheduler.
     *
     * @return default filters
     */
    public static List<LogPatternFilter> defaults() {
        return List.of(
            new LogPatternFilter("Error", ERROR),
            new LogPatternFilter("Logging error", TOTAL_REQUERY_ERROR),
            new LogPatternFilter("Error creating schedule rule", SCHEDULE_RULE_CREATION_ERROR),
            new LogPatternFilter("Error enqueueing scheduled trigger", SCHEDULER_FAILURE)
        );
    }
}
