package com.ivamare.pipeline.scheduler;

import com.ivamare.pipeline.exception.ScheduleRuleException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Cron schedule evaluated in UTC.
 */
public final class CronSchedule implements ScheduleExpression {

    private final String cron;
    private final CronExpression expression;

    private CronSchedule(String cron, CronExpression expression) {
        this.cron = cron;
        this.expression = expression;
    }

    static CronSchedule parse(String cron) {
        try {
            return new CronSchedule(cron.trim(), CronExpression.parse(cron.trim()));
        } catch (IllegalArgumentException e) {
            throw new ScheduleRuleException("Invalid cron expression '" + cron + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Instant next(Instant after) {
        ZonedDateTime next = expression.next(after.atZone(ZoneOffset.UTC));
        if (next == null) {
            throw new ScheduleRuleException("Cron expression '" + cron + "' never fires again");
        }
        return next.toInstant();
    }

    @Override
    public String expression() {
        return "cron(" + cron + ")";
    }

    @Override
    public String toString() {
        return expression();
    }
}
