package com.ivamare.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One delivery of a queued message.
 *
 * <p>{@code messageId} is stable across redeliveries; {@code receiptHandle} identifies
 * this particular lease and changes on every delivery. Only the current receipt handle
 * can acknowledge the message.
 *
 * @param messageId Stable message identifier
 * @param receiptHandle Lease identifier for this delivery
 * @param payload Message body
 * @param deliveryCount How many times the message has been delivered, including this one
 * @param enqueuedAt When the message was first enqueued
 * @param visibilityDeadline When this lease expires and the message becomes visible again
 */
public record QueueMessage(
    String messageId,
    String receiptHandle,
    Map<String, Object> payload,
    int deliveryCount,
    Instant enqueuedAt,
    Instant visibilityDeadline
) {
    public QueueMessage {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }
}
