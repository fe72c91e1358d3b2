package com.ivamare.pipeline.scheduler;

import java.time.Instant;

/**
 * A schedule rule as held by a {@link ScheduleRuleStore}.
 *
 * @param rule The rule
 * @param nextFire When the rule is next due
 */
public record StoredRule(ScheduleRule rule, Instant nextFire) {

    public String name() {
        return rule.name();
    }

    public boolean isDue(Instant now) {
        return !nextFire.isAfter(now);
    }
}
