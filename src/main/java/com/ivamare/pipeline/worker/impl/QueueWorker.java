package com.ivamare.pipeline.worker.impl;

import com.ivamare.pipeline.exception.DatabaseExceptionClassifier;
import com.ivamare.pipeline.handler.ActionContext;
import com.ivamare.pipeline.handler.ActionRegistry;
import com.ivamare.pipeline.model.ActionMessage;
import com.ivamare.pipeline.model.LeaseState;
import com.ivamare.pipeline.model.OutboundMessage;
import com.ivamare.pipeline.model.QueueMessage;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.worker.Worker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker running {@code concurrency} polling loops against one queue.
 *
 * <p>Every loop leases one message at a time: receive, dispatch, enqueue the staged
 * downstream messages, acknowledge. The only failure handling is not acknowledging;
 * redelivery and dead-lettering are left to the queue.
 */
public class QueueWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private static final int BATCH_SIZE = 1;

    private final String name;
    private final MessageQueue queue;
    private final QueueRegistry queueRegistry;
    private final ActionRegistry actionRegistry;
    private final int concurrency;
    private final int pollIntervalMs;
    private final Duration waitTimeout;

    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double backoffMultiplier;
    private final int errorThreshold;

    private final Counter committedCounter;
    private final Counter failedCounter;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final AtomicInteger threadIndex = new AtomicInteger(0);

    private ExecutorService executor;

    public QueueWorker(
            String name,
            MessageQueue queue,
            QueueRegistry queueRegistry,
            ActionRegistry actionRegistry,
            MeterRegistry meterRegistry,
            int concurrency,
            int pollIntervalMs,
            Duration waitTimeout,
            long initialBackoffMs,
            long maxBackoffMs,
            double backoffMultiplier,
            int errorThreshold) {
        this.name = name;
        this.queue = queue;
        this.queueRegistry = queueRegistry;
        this.actionRegistry = actionRegistry;
        this.concurrency = concurrency;
        this.pollIntervalMs = pollIntervalMs;
        this.waitTimeout = waitTimeout;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.backoffMultiplier = backoffMultiplier;
        this.errorThreshold = errorThreshold;

        this.committedCounter = outcomeCounter(meterRegistry, "committed");
        this.failedCounter = outcomeCounter(meterRegistry, "failed");
    }

    private Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("pipeline.worker.messages")
            .description("Messages processed by pipeline workers")
            .tag("worker", name)
            .tag("outcome", outcome)
            .register(meterRegistry);
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Worker {} already running", name);
            return;
        }

        stopping.set(false);
        executor = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, name + "-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        log.info("Starting worker {} on queue={}, concurrency={}, waitTimeout={}",
            name, queue.name(), concurrency, waitTimeout);

        for (int i = 0; i < concurrency; i++) {
            executor.submit(this::pollLoop);
        }
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping worker {}, waiting for {} in-flight messages", name, inFlightCount.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(100);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight messages on {}, leases will expire",
                        inFlightCount.get(), name);
                }

                running.set(false);
                executor.shutdown();
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }

                log.info("Worker {} stopped", name);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String queueName() {
        return queue.name();
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    // --- Polling Loop ---

    private void pollLoop() {
        log.debug("Poll loop started for {}", name);
        try {
            while (running.get() && !stopping.get()) {
                try {
                    LeaseState outcome = processNext();
                    consecutiveErrors.set(0);
                    if (outcome == LeaseState.IDLE && waitTimeout.isZero() && !stopping.get()) {
                        sleep(pollIntervalMs);
                    }
                } catch (RuntimeException e) {
                    if (stopping.get()) {
                        break;
                    }
                    int errors = consecutiveErrors.incrementAndGet();
                    long backoff = calculateBackoff(errors);

                    if (DatabaseExceptionClassifier.isTransient(e)) {
                        logConnectionError(errors, backoff, e);
                    } else {
                        log.error("Non-transient error in worker loop for {}: {}", name, e.getMessage(), e);
                    }
                    sleep(backoff);
                }
            }
        } finally {
            log.debug("Poll loop ended for {}", name);
        }
    }

    /**
     * Calculate exponential backoff delay with jitter.
     *
     * @param errorCount consecutive error count (1-based)
     * @return delay in milliseconds
     */
    long calculateBackoff(int errorCount) {
        if (errorCount <= 0) {
            return initialBackoffMs;
        }
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, errorCount - 1);
        // +/- 10% jitter
        double jitter = delay * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        return Math.min((long) (delay + jitter), maxBackoffMs);
    }

    private void logConnectionError(int errorCount, long backoffMs, Exception e) {
        String reason = DatabaseExceptionClassifier.getTransientReason(e);
        String message = "Worker {} queue unavailable (count={}, reason={}), backing off {}ms: {}";

        if (errorCount >= errorThreshold) {
            log.error(message, name, errorCount, reason, backoffMs, e.getMessage());
        } else {
            log.warn(message, name, errorCount, reason, backoffMs, e.getMessage());
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Lease State Machine ---

    @Override
    public LeaseState processNext() {
        Optional<QueueMessage> leased = queue.receive(BATCH_SIZE, waitTimeout).stream().findFirst();
        if (leased.isEmpty()) {
            return LeaseState.IDLE;
        }

        inFlightCount.incrementAndGet();
        try {
            LeaseState outcome = process(leased.get());
            (outcome == LeaseState.COMMITTED ? committedCounter : failedCounter).increment();
            return outcome;
        } finally {
            inFlightCount.decrementAndGet();
        }
    }

    private LeaseState process(QueueMessage message) {
        ActionContext context = new ActionContext(
            queue.name(),
            message,
            queue.settings().maxReceiveCount(),
            timeout -> queue.changeVisibility(message.receiptHandle(), timeout)
        );
        ActionMessage action = ActionMessage.fromMap(message.payload());

        try {
            actionRegistry.dispatch(action, context);
            for (OutboundMessage outbound : context.outbound()) {
                queueRegistry.get(outbound.queueName()).enqueue(outbound.message().toMap());
            }
        } catch (Exception e) {
            log.error("Error processing message {} on {} (action={}, delivery {}/{}): {}",
                message.messageId(), queue.name(), action.action(),
                message.deliveryCount(), queue.settings().maxReceiveCount(), e.getMessage(), e);
            return LeaseState.FAILED;
        }

        boolean acknowledged;
        try {
            acknowledged = queue.acknowledge(message.receiptHandle());
        } catch (RuntimeException e) {
            log.error("Error acknowledging message {} on {}, it will be redelivered: {}",
                message.messageId(), queue.name(), e.getMessage(), e);
            return LeaseState.FAILED;
        }
        if (!acknowledged) {
            log.warn("Lease on message {} ({}) expired before acknowledgement; it may be processed again",
                message.messageId(), queue.name());
        }

        log.debug("Committed message {} on {} (action={}, {} downstream)",
            message.messageId(), queue.name(), action.action(), context.outbound().size());
        return LeaseState.COMMITTED;
    }
}
