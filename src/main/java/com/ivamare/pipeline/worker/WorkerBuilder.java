package com.ivamare.pipeline.worker;

import com.ivamare.pipeline.handler.ActionRegistry;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.worker.impl.QueueWorker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Builder for creating Worker instances.
 */
public class WorkerBuilder {

    private String name;
    private QueueRegistry queueRegistry;
    private String queueName;
    private ActionRegistry actionRegistry;
    private MeterRegistry meterRegistry;
    private int concurrency = 1;
    private int pollIntervalMs = 1000;
    private Duration waitTimeout = Duration.ofSeconds(20);
    private long initialBackoffMs = 1000;
    private long maxBackoffMs = 60000;
    private double backoffMultiplier = 2.0;
    private int errorThreshold = 5;

    /**
     * Set the worker name. Defaults to {@code <queueName>-worker}.
     *
     * @param name The worker name
     * @return this builder
     */
    public WorkerBuilder name(String name) {
        this.name = name;
        return this;
    }

    /**
     * Set the registry used to resolve the consumed queue and downstream queues.
     *
     * @param queueRegistry The queue registry
     * @return this builder
     */
    public WorkerBuilder queueRegistry(QueueRegistry queueRegistry) {
        this.queueRegistry = queueRegistry;
        return this;
    }

    /**
     * Set the queue to consume.
     *
     * @param queueName The queue name
     * @return this builder
     */
    public WorkerBuilder queueName(String queueName) {
        this.queueName = queueName;
        return this;
    }

    public WorkerBuilder actionRegistry(ActionRegistry actionRegistry) {
        this.actionRegistry = actionRegistry;
        return this;
    }

    public WorkerBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }

    public WorkerBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Set the idle sleep used when the receive wait timeout is zero.
     *
     * @param ms Poll interval in milliseconds
     * @return this builder
     */
    public WorkerBuilder pollIntervalMs(int ms) {
        this.pollIntervalMs = ms;
        return this;
    }

    /**
     * Set how long a single receive blocks waiting for a message.
     *
     * @param waitTimeout Receive wait timeout
     * @return this builder
     */
    public WorkerBuilder waitTimeout(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
        return this;
    }

    public WorkerBuilder initialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
        return this;
    }

    public WorkerBuilder maxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
        return this;
    }

    public WorkerBuilder backoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
        return this;
    }

    /**
     * Set the consecutive error count from which backoff messages are logged as errors.
     *
     * @param errorThreshold Error threshold
     * @return this builder
     */
    public WorkerBuilder errorThreshold(int errorThreshold) {
        this.errorThreshold = errorThreshold;
        return this;
    }

    public Worker build() {
        if (queueRegistry == null) {
            throw new IllegalStateException("queueRegistry is required");
        }
        if (queueName == null) {
            throw new IllegalStateException("queueName is required");
        }
        if (actionRegistry == null) {
            throw new IllegalStateException("actionRegistry is required");
        }
        if (concurrency < 1) {
            throw new IllegalStateException("concurrency must be at least 1");
        }

        if (name == null) {
            name = queueName + "-worker";
        }
        if (meterRegistry == null) {
            meterRegistry = new SimpleMeterRegistry();
        }
        if (waitTimeout == null) {
            waitTimeout = Duration.ZERO;
        }

        return new QueueWorker(
            name,
            queueRegistry.get(queueName),
            queueRegistry,
            actionRegistry,
            meterRegistry,
            concurrency,
            pollIntervalMs,
            waitTimeout,
            initialBackoffMs,
            maxBackoffMs,
            backoffMultiplier,
            errorThreshold
        );
    }
}
