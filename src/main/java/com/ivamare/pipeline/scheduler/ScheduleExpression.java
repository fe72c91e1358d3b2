package com.ivamare.pipeline.scheduler;

import com.ivamare.pipeline.exception.ScheduleRuleException;

import java.time.Instant;
import java.util.Locale;

/**
 * When a schedule rule fires.
 *
 * <p>Accepted forms:
 * <pre>
 * cron(0 0 10 * * *)     six-field Spring cron, evaluated in UTC
 * 0 0 10 * * *           the same without the wrapper
 * rate(2 minutes)        fixed period; units second(s), minute(s), hour(s), day(s)
 * </pre>
 */
public interface ScheduleExpression {

    /**
     * Next fire time strictly after {@code after}.
     *
     * @param after reference instant
     * @return next fire time
     */
    Instant next(Instant after);

    /**
     * @return the expression in its canonical textual form
     */
    String expression();

    /**
     * Parse a schedule expression.
     *
     * @param expression the expression text
     * @return parsed schedule
     * @throws ScheduleRuleException if the expression is not valid
     */
    static ScheduleExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleRuleException("Schedule expression is empty");
        }
        String trimmed = expression.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("rate(") && lower.endsWith(")")) {
            return RateSchedule.parse(trimmed.substring(5, trimmed.length() - 1));
        }
        if (lower.startsWith("cron(") && lower.endsWith(")")) {
            return CronSchedule.parse(trimmed.substring(5, trimmed.length() - 1));
        }
        return CronSchedule.parse(trimmed);
    }
}
