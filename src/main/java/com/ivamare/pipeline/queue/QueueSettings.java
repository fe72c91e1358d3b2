package com.ivamare.pipeline.queue;

import java.time.Duration;

/**
 * Lease and dead-letter settings of a queue.
 *
 * @param visibilityTimeoutSeconds How long a received message stays invisible
 * @param maxReceiveCount Deliveries allowed before the message is dead-lettered
 * @param deadLetterRetention How long dead-lettered messages are kept
 */
public record QueueSettings(
    int visibilityTimeoutSeconds,
    int maxReceiveCount,
    Duration deadLetterRetention
) {
    public QueueSettings {
        if (visibilityTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutSeconds must be positive");
        }
        if (maxReceiveCount <= 0) {
            throw new IllegalArgumentException("maxReceiveCount must be positive");
        }
        if (deadLetterRetention == null || deadLetterRetention.isNegative() || deadLetterRetention.isZero()) {
            throw new IllegalArgumentException("deadLetterRetention must be positive");
        }
    }

    /**
     * Settings of the ingestion trigger queue: 30 minute leases, 5 deliveries.
     */
    public static QueueSettings scraperDefaults() {
        return new QueueSettings(1800, 5, Duration.ofDays(14));
    }

    /**
     * Settings of the analysis queue: 15 minute leases, 2 deliveries, since every
     * retry costs a paid API call.
     */
    public static QueueSettings nlpDefaults() {
        return new QueueSettings(900, 2, Duration.ofDays(14));
    }

    public Duration visibilityTimeout() {
        return Duration.ofSeconds(visibilityTimeoutSeconds);
    }
}
