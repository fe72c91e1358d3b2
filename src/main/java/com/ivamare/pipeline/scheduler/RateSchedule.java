package com.ivamare.pipeline.scheduler;

import com.ivamare.pipeline.exception.ScheduleRuleException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Fixed-period schedule, first fire one period after registration.
 */
public final class RateSchedule implements ScheduleExpression {

    private final long amount;
    private final String unit;
    private final Duration period;

    private RateSchedule(long amount, String unit, Duration period) {
        this.amount = amount;
        this.unit = unit;
        this.period = period;
    }

    public static RateSchedule of(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new ScheduleRuleException("Rate period must be positive");
        }
        return new RateSchedule(period.toSeconds(), "seconds", period);
    }

    static RateSchedule parse(String body) {
        String[] parts = body.trim().split("\\s+");
        if (parts.length != 2) {
            throw new ScheduleRuleException("Invalid rate expression '" + body + "', expected '<n> <unit>'");
        }
        long amount;
        try {
            amount = Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            throw new ScheduleRuleException("Invalid rate amount '" + parts[0] + "'", e);
        }
        if (amount <= 0) {
            throw new ScheduleRuleException("Rate amount must be positive: " + amount);
        }
        String unit = parts[1].toLowerCase(Locale.ROOT);
        Duration period = switch (unit) {
            case "second", "seconds" -> Duration.ofSeconds(amount);
            case "minute", "minutes" -> Duration.ofMinutes(amount);
            case "hour", "hours" -> Duration.ofHours(amount);
            case "day", "days" -> Duration.ofDays(amount);
            default -> throw new ScheduleRuleException("Unknown rate unit '" + parts[1] + "'");
        };
        return new RateSchedule(amount, unit, period);
    }

    public Duration period() {
        return period;
    }

    @Override
    public Instant next(Instant after) {
        return after.plus(period);
    }

    @Override
    public String expression() {
        return "rate(" + amount + " " + unit + ")";
    }

    @Override
    public String toString() {
        return expression();
    }
}
