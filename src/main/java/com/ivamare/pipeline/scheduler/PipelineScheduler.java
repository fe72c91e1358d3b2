package com.ivamare.pipeline.scheduler;

import com.ivamare.pipeline.exception.ScheduleRuleException;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.scheduler.impl.InMemoryScheduleRuleStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Enqueues trigger messages for schedule rules.
 *
 * <p>Every due rule produces exactly one message per tick, whatever the backlog on
 * the target queue. The next fire time is computed from the tick time, so fires missed
 * while the process was down or the ticker was late are skipped. A failed enqueue is
 * counted and logged, never retried.
 *
 * <p>Rules and fire times live in a {@link ScheduleRuleStore}. With a shared store every
 * instance ticks, but each due fire is claimed by one of them only.
 */
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final QueueRegistry queueRegistry;
    private final Clock clock;
    private final Counter firedCounter;
    private final Counter failureCounter;
    private final ScheduleRuleStore store;
    private final AtomicLong failures = new AtomicLong();

    private ScheduledExecutorService executor;

    public PipelineScheduler(QueueRegistry queueRegistry, Clock clock, MeterRegistry meterRegistry) {
        this(queueRegistry, new InMemoryScheduleRuleStore(), clock, meterRegistry);
    }

    public PipelineScheduler(QueueRegistry queueRegistry,
                             ScheduleRuleStore store,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.queueRegistry = queueRegistry;
        this.store = store;
        this.clock = clock;
        this.firedCounter = Counter.builder("pipeline.scheduler.fired")
            .description("Scheduled trigger messages enqueued")
            .register(meterRegistry);
        this.failureCounter = Counter.builder("pipeline.scheduler.failures")
            .description("Scheduled trigger messages that could not be enqueued")
            .register(meterRegistry);
    }

    /**
     * Register a rule. Its first fire is the schedule's next time after now.
     *
     * @param rule the rule
     * @throws ScheduleRuleException if the name is taken or the target queue is unknown
     */
    public void register(ScheduleRule rule) {
        Instant firstFire = firstFire(rule);
        if (!store.insert(rule, firstFire)) {
            throw new ScheduleRuleException("Schedule rule already exists: " + rule.name());
        }
        log.info("Registered schedule rule {} ({}) -> {}, first fire at {}",
            rule.name(), rule.schedule().expression(), rule.targetQueue(), firstFire);
    }

    /**
     * Register a rule, replacing a stored rule of the same name. A stored rule with the
     * same schedule keeps its next fire time, so restarts do not shift its cadence.
     *
     * @param rule the rule
     * @throws ScheduleRuleException if the target queue is unknown
     */
    public void registerOrReplace(ScheduleRule rule) {
        store.save(rule, firstFire(rule));
        log.info("Registered schedule rule {} ({}) -> {}",
            rule.name(), rule.schedule().expression(), rule.targetQueue());
    }

    private Instant firstFire(ScheduleRule rule) {
        if (!queueRegistry.contains(rule.targetQueue())) {
            throw new ScheduleRuleException(
                "Rule " + rule.name() + " targets unknown queue " + rule.targetQueue());
        }
        return rule.schedule().next(clock.instant());
    }

    /**
     * Remove a rule. Removing an unknown rule is a no-op.
     *
     * @param name rule name
     * @return true if a rule was removed
     */
    public boolean remove(String name) {
        boolean removed = store.delete(name);
        if (removed) {
            log.info("Removed schedule rule {}", name);
        }
        return removed;
    }

    public boolean contains(String name) {
        return store.contains(name);
    }

    public List<ScheduleRule> rules() {
        return store.findAll().stream().map(StoredRule::rule).toList();
    }

    /**
     * Fire every rule that is due.
     *
     * @return number of rules that fired, successful or not
     */
    public synchronized int tick() {
        Instant now = clock.instant();
        int fired = 0;
        for (StoredRule due : store.findDue(now)) {
            try {
                if (claim(due.rule(), now)) {
                    fire(due.rule());
                    fired++;
                }
            } catch (RuntimeException e) {
                log.error("Error claiming schedule rule {}: {}", due.name(), e.getMessage());
            }
        }
        return fired;
    }

    private boolean claim(ScheduleRule rule, Instant now) {
        Instant nextFire;
        try {
            nextFire = rule.schedule().next(now);
        } catch (ScheduleRuleException e) {
            // last fire; deleting the rule is the claim
            boolean claimed = store.delete(rule.name());
            if (claimed) {
                log.warn("Removing schedule rule {} after its last fire: {}", rule.name(), e.getMessage());
            }
            return claimed;
        }
        return store.claim(rule.name(), now, nextFire);
    }

    private void fire(ScheduleRule rule) {
        try {
            MessageQueue queue = queueRegistry.get(rule.targetQueue());
            String messageId = queue.enqueue(rule.payload());
            firedCounter.increment();
            log.info("Schedule rule {} enqueued message {} on {}", rule.name(), messageId, rule.targetQueue());
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            failureCounter.increment();
            log.error("Error enqueueing scheduled trigger for rule {} on {}: {}",
                rule.name(), rule.targetQueue(), e.getMessage());
        }
    }

    /**
     * @return enqueue failures since startup
     */
    public long failureCount() {
        return failures.get();
    }

    /**
     * Start ticking in the background.
     *
     * @param tickInterval time between ticks
     */
    public synchronized void start(Duration tickInterval) {
        if (executor != null) {
            log.warn("Scheduler already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = tickInterval.toMillis();
        executor.scheduleWithFixedDelay(this::safeTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler started, tick interval {}ms", intervalMs);
    }

    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
            log.info("Scheduler stopped");
        }
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // keep the ticker alive; a thrown exception would cancel the schedule
            log.warn("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }
}
