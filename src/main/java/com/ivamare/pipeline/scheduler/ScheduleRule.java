package com.ivamare.pipeline.scheduler;

import com.ivamare.pipeline.model.ActionMessage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A rule that enqueues a fixed payload on a schedule.
 *
 * @param name Unique rule name
 * @param schedule When the rule fires
 * @param targetQueue Queue receiving the trigger message
 * @param payload Message body enqueued on every fire
 */
public record ScheduleRule(String name, ScheduleExpression schedule, String targetQueue, Map<String, Object> payload) {

    public ScheduleRule {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * Rule whose payload is an action envelope.
     *
     * @param name Unique rule name
     * @param expression Schedule expression, see {@link ScheduleExpression#parse}
     * @param targetQueue Target queue
     * @param message Message envelope
     * @return the rule
     */
    public static ScheduleRule of(String name, String expression, String targetQueue, ActionMessage message) {
        return new ScheduleRule(name, ScheduleExpression.parse(expression), targetQueue, message.toMap());
    }
}
