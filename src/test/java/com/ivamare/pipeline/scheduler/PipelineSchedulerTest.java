package com.ivamare.pipeline.scheduler;

import com.ivamare.pipeline.MutableClock;
import com.ivamare.pipeline.exception.QueueUnavailableException;
import com.ivamare.pipeline.exception.ScheduleRuleException;
import com.ivamare.pipeline.model.ActionMessage;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.queue.QueueSettings;
import com.ivamare.pipeline.queue.impl.InMemoryMessageQueue;
import com.ivamare.pipeline.scheduler.impl.InMemoryScheduleRuleStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("PipelineScheduler")
class PipelineSchedulerTest {

    private MutableClock clock;
    private InMemoryMessageQueue scraperQueue;
    private SimpleMeterRegistry meterRegistry;
    private PipelineScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T09:00:00Z");
        scraperQueue = new InMemoryMessageQueue(QueueNames.SCRAPER_QUEUE, QueueSettings.scraperDefaults(), clock);
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new PipelineScheduler(new QueueRegistry(List.of(scraperQueue)), clock, meterRegistry);
    }

    private ScheduleRule hourlyIngest() {
        return ScheduleRule.of("scraper-hourly", "rate(1 hour)", QueueNames.SCRAPER_QUEUE, ActionMessage.of("e_ingest"));
    }

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("should reject duplicate rule names")
        void shouldRejectDuplicateName() {
            scheduler.register(hourlyIngest());

            assertThrows(ScheduleRuleException.class, () -> scheduler.register(hourlyIngest()));
        }

        @Test
        @DisplayName("should reject rules targeting an unknown queue")
        void shouldRejectUnknownQueue() {
            ScheduleRule rule = ScheduleRule.of("bad", "rate(1 hour)", "missing-queue", ActionMessage.of("e_ingest"));

            assertThrows(ScheduleRuleException.class, () -> scheduler.register(rule));
            assertFalse(scheduler.contains("bad"));
        }

        @Test
        @DisplayName("should remove rules and ignore unknown names")
        void shouldRemoveRule() {
            scheduler.register(hourlyIngest());

            assertTrue(scheduler.remove("scraper-hourly"));
            assertFalse(scheduler.remove("scraper-hourly"));
            assertTrue(scheduler.rules().isEmpty());
        }
    }

    @Nested
    @DisplayName("tick")
    class TickTests {

        @Test
        @DisplayName("should not fire before the first scheduled time")
        void shouldNotFireEarly() {
            scheduler.register(hourlyIngest());
            clock.advance(Duration.ofMinutes(59));

            assertEquals(0, scheduler.tick());
            assertEquals(0, scraperQueue.stats().depth());
        }

        @Test
        @DisplayName("should enqueue one trigger per due rule with the rule payload")
        void shouldEnqueueTrigger() {
            scheduler.register(hourlyIngest());
            clock.advance(Duration.ofHours(1));

            assertEquals(1, scheduler.tick());

            Map<String, Object> body = scraperQueue.receive(1, Duration.ZERO).get(0).payload();
            assertEquals("e_ingest", body.get("action"));
            assertEquals(1.0, meterRegistry.get("pipeline.scheduler.fired").counter().count());
        }

        @Test
        @DisplayName("should keep firing while earlier triggers are still unacknowledged")
        void shouldFireDespiteBacklog() {
            scheduler.register(hourlyIngest());

            for (int hour = 0; hour < 3; hour++) {
                clock.advance(Duration.ofHours(1));
                assertEquals(1, scheduler.tick());
                // backlog: lease a trigger and never acknowledge it
                scraperQueue.receive(1, Duration.ZERO);
            }

            assertEquals(3, scraperQueue.stats().depth());
        }

        @Test
        @DisplayName("should fire once for missed periods instead of catching up")
        void shouldSkipMissedFires() {
            scheduler.register(hourlyIngest());
            clock.advance(Duration.ofHours(5));

            assertEquals(1, scheduler.tick());
            assertEquals(0, scheduler.tick());
            assertEquals(1, scraperQueue.stats().depth());
        }

        @Test
        @DisplayName("should follow cron schedules in UTC")
        void shouldFollowCron() {
            scheduler.register(ScheduleRule.of("scraper-daily", "cron(0 0 10 * * *)", QueueNames.SCRAPER_QUEUE,
                ActionMessage.of("e_ingest")));

            clock.advance(Duration.ofMinutes(59));
            assertEquals(0, scheduler.tick());
            clock.advance(Duration.ofMinutes(1));
            assertEquals(1, scheduler.tick());
            clock.advance(Duration.ofHours(23));
            assertEquals(0, scheduler.tick());
        }

        @Test
        @DisplayName("should count and log enqueue failures without retrying")
        void shouldCountFailures() {
            MessageQueue broken = mock(MessageQueue.class);
            when(broken.name()).thenReturn(QueueNames.SCRAPER_QUEUE);
            when(broken.enqueue(any())).thenThrow(
                new QueueUnavailableException(QueueNames.SCRAPER_QUEUE, "send failed", null));
            PipelineScheduler failing = new PipelineScheduler(new QueueRegistry(List.of(broken)), clock, meterRegistry);
            failing.register(hourlyIngest());

            clock.advance(Duration.ofHours(1));
            assertEquals(1, failing.tick());
            assertEquals(0, failing.tick());

            assertEquals(1, failing.failureCount());
            assertEquals(1.0, meterRegistry.get("pipeline.scheduler.failures").counter().count());
            verify(broken, times(1)).enqueue(any());
        }

        @Test
        @DisplayName("should drop a rule that never fires again without skipping the other rules")
        void shouldDropExhaustedRule() {
            Instant lastFire = clock.instant().plus(Duration.ofMinutes(30));
            ScheduleExpression once = mock(ScheduleExpression.class);
            when(once.expression()).thenReturn("cron(0 30 9 1 3 *)");
            when(once.next(any()))
                .thenReturn(lastFire)
                .thenThrow(new ScheduleRuleException("Cron expression '0 30 9 1 3 *' never fires again"));
            scheduler.register(new ScheduleRule("a-once", once, QueueNames.SCRAPER_QUEUE, Map.of("action", "e_once")));
            scheduler.register(hourlyIngest());

            clock.advance(Duration.ofHours(1));

            assertEquals(2, scheduler.tick());
            assertFalse(scheduler.contains("a-once"));
            assertTrue(scheduler.contains("scraper-hourly"));
            assertEquals(2, scraperQueue.stats().depth());
            assertEquals(0, scheduler.tick());
        }
    }

    @Nested
    @DisplayName("shared rule store")
    class SharedStoreTests {

        private InMemoryScheduleRuleStore store;
        private QueueRegistry queues;

        @BeforeEach
        void setUp() {
            store = new InMemoryScheduleRuleStore();
            queues = new QueueRegistry(List.of(scraperQueue));
        }

        @Test
        @DisplayName("should fire each due rule once across scheduler instances")
        void shouldFireOnceAcrossInstances() {
            PipelineScheduler first = new PipelineScheduler(queues, store, clock, meterRegistry);
            PipelineScheduler second = new PipelineScheduler(queues, store, clock, meterRegistry);
            first.registerOrReplace(hourlyIngest());
            second.registerOrReplace(hourlyIngest());

            clock.advance(Duration.ofHours(1));

            assertEquals(1, first.tick() + second.tick());
            assertEquals(1, scraperQueue.stats().depth());
        }

        @Test
        @DisplayName("should keep rules and their cadence across a restart")
        void shouldKeepRulesAcrossRestart() {
            PipelineScheduler before = new PipelineScheduler(queues, store, clock, meterRegistry);
            before.register(ScheduleRule.of("batch-check-b1", "rate(2 minutes)", QueueNames.SCRAPER_QUEUE,
                ActionMessage.of("e_event_retriever")));
            before.registerOrReplace(hourlyIngest());
            clock.advance(Duration.ofMinutes(50));

            PipelineScheduler after = new PipelineScheduler(queues, store, clock, meterRegistry);
            after.registerOrReplace(hourlyIngest());

            assertTrue(after.contains("batch-check-b1"));
            assertEquals(1, after.tick());
            clock.advance(Duration.ofMinutes(10));
            assertEquals(2, after.tick());
        }

        @Test
        @DisplayName("should reschedule a stored rule whose schedule changed")
        void shouldRescheduleChangedRule() {
            PipelineScheduler scheduler = new PipelineScheduler(queues, store, clock, meterRegistry);
            scheduler.registerOrReplace(hourlyIngest());
            scheduler.registerOrReplace(ScheduleRule.of("scraper-hourly", "rate(10 minutes)",
                QueueNames.SCRAPER_QUEUE, ActionMessage.of("e_ingest")));

            clock.advance(Duration.ofMinutes(10));

            assertEquals(1, scheduler.tick());
            assertEquals("rate(10 minutes)", scheduler.rules().get(0).schedule().expression());
        }
    }

    @Test
    @DisplayName("should start and stop the background ticker")
    void shouldStartAndStop() {
        scheduler.start(Duration.ofSeconds(1));
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
