package com.ivamare.pipeline;

import com.ivamare.pipeline.handler.ActionRegistry;
import com.ivamare.pipeline.handler.impl.DefaultActionRegistry;
import com.ivamare.pipeline.queue.DeadLetterOperations;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.queue.QueueSettings;
import com.ivamare.pipeline.queue.impl.DefaultDeadLetterOperations;
import com.ivamare.pipeline.queue.impl.InMemoryMessageQueue;
import com.ivamare.pipeline.worker.Worker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("WorkerAutoStartConfiguration")
class WorkerAutoStartConfigurationTest {

    private ActionRegistry actionRegistry;
    private PipelineProperties properties;
    private WorkerAutoStartConfiguration configuration;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        QueueRegistry queueRegistry = new QueueRegistry(List.of(
            new InMemoryMessageQueue(QueueNames.SCRAPER_QUEUE, QueueSettings.scraperDefaults(), Clock.systemUTC()),
            new InMemoryMessageQueue(QueueNames.NLP_QUEUE, QueueSettings.nlpDefaults(), Clock.systemUTC())));
        DeadLetterOperations deadLetterOperations = new DefaultDeadLetterOperations(queueRegistry);
        actionRegistry = new DefaultActionRegistry();
        properties = new PipelineProperties();
        properties.getWorker().setPollIntervalMs(50);
        properties.getWorker().setWaitTimeout(Duration.ofMillis(100));
        properties.getWorker().setShutdownTimeout(Duration.ofSeconds(5));

        ObjectProvider<MeterRegistry> meterRegistry = mock(ObjectProvider.class);
        when(meterRegistry.getIfAvailable(any())).thenReturn(new SimpleMeterRegistry());

        configuration = new WorkerAutoStartConfiguration(
            queueRegistry, actionRegistry, deadLetterOperations, meterRegistry, properties);
    }

    @AfterEach
    void tearDown() {
        configuration.stopWorkers();
    }

    @Test
    @DisplayName("should not start workers when no actions registered")
    void shouldNotStartWithoutActions() {
        configuration.startWorkers();

        assertTrue(configuration.pipelineWorkers().isEmpty());
        assertEquals(Status.UNKNOWN, configuration.workerHealthIndicator().health().getStatus());
    }

    @Test
    @DisplayName("should start one worker per queue with actions")
    void shouldStartWorkerPerQueue() {
        actionRegistry.register(QueueNames.SCRAPER_QUEUE, "e_ingest", (message, context) -> { });
        actionRegistry.register(QueueNames.NLP_QUEUE, "e_event_extractor", (message, context) -> { });
        actionRegistry.register(QueueNames.NLP_QUEUE, "e_event_retriever", (message, context) -> { });

        configuration.startWorkers();

        List<Worker> workers = configuration.pipelineWorkers();
        assertEquals(2, workers.size());
        assertEquals(QueueNames.NLP_QUEUE, workers.get(0).queueName());
        assertEquals(QueueNames.SCRAPER_QUEUE, workers.get(1).queueName());
        assertTrue(workers.stream().allMatch(Worker::isRunning));
        assertEquals(Status.UP, configuration.workerHealthIndicator().health().getStatus());

        configuration.stopWorkers();

        assertTrue(workers.stream().noneMatch(Worker::isRunning));
    }

    @Test
    @DisplayName("should skip actions registered for unknown queues")
    void shouldSkipUnknownQueue() {
        actionRegistry.register("missing-queue", "e_ingest", (message, context) -> { });

        configuration.startWorkers();

        assertTrue(configuration.pipelineWorkers().isEmpty());
    }
}
