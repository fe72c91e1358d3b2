package com.ivamare.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message relocated to a dead-letter queue after exhausting its receive budget.
 *
 * @param sourceQueue Queue the message was relocated from
 * @param messageId Original message ID
 * @param payload Original, unmodified payload
 * @param deliveryCount Deliveries made before relocation
 * @param enqueuedAt When the message was originally enqueued
 * @param deadLetteredAt When the message was relocated
 */
public record DeadLetterEntry(
    String sourceQueue,
    String messageId,
    Map<String, Object> payload,
    int deliveryCount,
    Instant enqueuedAt,
    Instant deadLetteredAt
) {
    public DeadLetterEntry {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }
}
