package com.ivamare.pipeline;

import com.ivamare.pipeline.handler.ActionRegistry;
import com.ivamare.pipeline.health.WorkerHealthIndicator;
import com.ivamare.pipeline.queue.DeadLetterOperations;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.worker.Worker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Auto-start configuration for workers.
 *
 * <p>Enable with:
 * <pre>
 * pipeline:
 *   worker:
 *     auto-start: true
 * </pre>
 *
 * <p>One worker is started for each queue with registered actions. Expired
 * dead-letter entries are purged hourly while workers run.
 */
@AutoConfiguration(after = PipelineAutoConfiguration.class)
@ConditionalOnProperty(prefix = "pipeline.worker", name = "auto-start", havingValue = "true")
public class WorkerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerAutoStartConfiguration.class);

    private final List<Worker> workers = new ArrayList<>();
    private final QueueRegistry queueRegistry;
    private final ActionRegistry actionRegistry;
    private final DeadLetterOperations deadLetterOperations;
    private final MeterRegistry meterRegistry;
    private final PipelineProperties properties;

    private ScheduledExecutorService purgeExecutor;

    public WorkerAutoStartConfiguration(
            QueueRegistry queueRegistry,
            ActionRegistry actionRegistry,
            DeadLetterOperations deadLetterOperations,
            ObjectProvider<MeterRegistry> meterRegistry,
            PipelineProperties properties) {
        this.queueRegistry = queueRegistry;
        this.actionRegistry = actionRegistry;
        this.deadLetterOperations = deadLetterOperations;
        this.meterRegistry = meterRegistry.getIfAvailable(SimpleMeterRegistry::new);
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        List<String> queueNames = actionRegistry.registeredActions().stream()
            .map(ActionRegistry.ActionKey::queueName)
            .distinct()
            .sorted()
            .toList();

        if (queueNames.isEmpty()) {
            log.warn("No actions registered, no workers to start");
            return;
        }

        PipelineProperties.WorkerProperties wp = properties.getWorker();
        PipelineProperties.ResilienceProperties rp = wp.getResilience();

        for (String queueName : queueNames) {
            if (!queueRegistry.contains(queueName)) {
                log.warn("Actions registered for unknown queue {}, no worker started", queueName);
                continue;
            }
            Worker worker = Worker.builder()
                .queueRegistry(queueRegistry)
                .queueName(queueName)
                .actionRegistry(actionRegistry)
                .meterRegistry(meterRegistry)
                .concurrency(wp.getConcurrency())
                .pollIntervalMs(wp.getPollIntervalMs())
                .waitTimeout(wp.getWaitTimeout())
                .initialBackoffMs(rp.getInitialBackoffMs())
                .maxBackoffMs(rp.getMaxBackoffMs())
                .backoffMultiplier(rp.getBackoffMultiplier())
                .errorThreshold(rp.getErrorThreshold())
                .build();

            worker.start();
            workers.add(worker);

            log.info("Started worker for queue={} actions={}", queueName, actionRegistry.actionsFor(queueName));
        }

        purgeExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-dlq-purge");
            thread.setDaemon(true);
            return thread;
        });
        purgeExecutor.scheduleWithFixedDelay(this::purgeDeadLetters, 0, 1, TimeUnit.HOURS);
    }

    private void purgeDeadLetters() {
        try {
            deadLetterOperations.purgeExpired();
        } catch (RuntimeException e) {
            log.warn("Dead-letter purge failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stopWorkers() {
        if (purgeExecutor != null) {
            purgeExecutor.shutdownNow();
        }
        if (workers.isEmpty()) {
            return;
        }

        log.info("Stopping {} workers...", workers.size());

        workers.stream()
            .map(w -> w.stop(properties.getWorker().getShutdownTimeout()))
            .toList()
            .forEach(CompletableFuture::join);

        log.info("All workers stopped");
    }

    @Bean
    public List<Worker> pipelineWorkers() {
        return workers;
    }

    @Bean
    public HealthIndicator workerHealthIndicator() {
        return new WorkerHealthIndicator(workers);
    }
}
