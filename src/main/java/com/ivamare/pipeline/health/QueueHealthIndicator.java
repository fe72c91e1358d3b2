package com.ivamare.pipeline.health;

import com.ivamare.pipeline.exception.DatabaseExceptionClassifier;
import com.ivamare.pipeline.model.QueueStats;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator reporting queue depths.
 *
 * <p>Dead-lettered messages are reported but do not make the pipeline unhealthy; they
 * are an alerting concern. Down only when a queue cannot be read.
 */
public class QueueHealthIndicator implements HealthIndicator {

    private final QueueRegistry queueRegistry;

    public QueueHealthIndicator(QueueRegistry queueRegistry) {
        this.queueRegistry = queueRegistry;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        for (MessageQueue queue : queueRegistry.all()) {
            try {
                QueueStats stats = queue.stats();
                details.put(queue.name(), Map.of(
                    "visible", stats.visible(),
                    "inFlight", stats.inFlight(),
                    "deadLettered", stats.deadLettered()));
            } catch (RuntimeException e) {
                return Health.down()
                    .withDetail("queue", queue.name())
                    .withDetail("error", e.getMessage())
                    .withDetail("transient", DatabaseExceptionClassifier.isTransient(e))
                    .build();
            }
        }
        return Health.up().withDetails(details).build();
    }
}
