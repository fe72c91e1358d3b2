package com.ivamare.pipeline.health;

import com.ivamare.pipeline.worker.Worker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for queue workers.
 *
 * <p>Down when a worker is stopped or keeps failing to reach its queue.
 */
public class WorkerHealthIndicator implements HealthIndicator {

    static final int ERROR_THRESHOLD = 5;

    private final List<Worker> workers;

    public WorkerHealthIndicator(List<Worker> workers) {
        this.workers = workers != null ? workers : List.of();
    }

    @Override
    public Health health() {
        if (workers.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No workers registered")
                .build();
        }

        Map<String, WorkerStatus> statuses = new LinkedHashMap<>();
        boolean allRunning = true;
        int totalInFlight = 0;
        int maxConsecutiveErrors = 0;
        for (Worker worker : workers) {
            statuses.putIfAbsent(worker.name(), new WorkerStatus(
                worker.queueName(), worker.isRunning(), worker.inFlightCount(), worker.getConsecutiveErrorCount()));
            allRunning &= worker.isRunning();
            totalInFlight += worker.inFlightCount();
            maxConsecutiveErrors = Math.max(maxConsecutiveErrors, worker.getConsecutiveErrorCount());
        }

        Health.Builder builder = allRunning && maxConsecutiveErrors < ERROR_THRESHOLD ? Health.up() : Health.down();
        return builder
            .withDetail("workers", statuses)
            .withDetail("totalInFlight", totalInFlight)
            .withDetail("maxConsecutiveErrors", maxConsecutiveErrors)
            .build();
    }

    record WorkerStatus(String queue, boolean running, int inFlight, int consecutiveErrors) {}
}
