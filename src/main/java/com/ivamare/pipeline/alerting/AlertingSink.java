package com.ivamare.pipeline.alerting;

import com.ivamare.pipeline.model.DeadLetterEntry;
import com.ivamare.pipeline.queue.DeadLetterListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Watches pipeline error signals and notifies operators on alarm transitions.
 *
 * <p>Inputs are dead-letter arrivals (metric {@code DeadLetter.<queue>}), log lines
 * counted by {@link ErrorLogAppender}, and metrics recorded directly. Each
 * {@link #evaluate()} recomputes every alarm's windowed Sum; only {@code OK -> ALARM}
 * transitions reach the notification channels.
 */
public class AlertingSink implements DeadLetterListener {

    private static final Logger log = LoggerFactory.getLogger(AlertingSink.class);

    public static final String DEAD_LETTER_METRIC_PREFIX = "DeadLetter.";

    private final MetricWindowStore metrics;
    private final Clock clock;
    private final List<NotificationChannel> channels;
    private final Map<String, Alarm> alarms = new ConcurrentHashMap<>();

    private ScheduledExecutorService executor;

    public AlertingSink(MetricWindowStore metrics, Clock clock, Collection<? extends NotificationChannel> channels) {
        this.metrics = metrics;
        this.clock = clock;
        this.channels = new CopyOnWriteArrayList<>(channels);
    }

    public static String deadLetterMetric(String queueName) {
        return DEAD_LETTER_METRIC_PREFIX + queueName;
    }

    /**
     * Add an alarm.
     *
     * @param definition the alarm definition
     * @throws IllegalArgumentException if an alarm with the same name exists
     */
    public void addAlarm(AlarmDefinition definition) {
        if (alarms.putIfAbsent(definition.name(), new Alarm(definition)) != null) {
            throw new IllegalArgumentException("Alarm already defined: " + definition.name());
        }
        metrics.retainAtLeast(definition.evaluationWindow());
        log.debug("Added alarm {} on {} (threshold {} {}, window {})", definition.name(), definition.metric(),
            definition.comparison().symbol(), definition.threshold(), definition.evaluationWindow());
    }

    public Optional<Alarm> alarm(String name) {
        return Optional.ofNullable(alarms.get(name));
    }

    public List<Alarm> alarms() {
        return List.copyOf(alarms.values());
    }

    public void addChannel(NotificationChannel channel) {
        channels.add(channel);
    }

    @Override
    public void onDeadLetter(DeadLetterEntry entry) {
        metrics.record(deadLetterMetric(entry.sourceQueue()));
        log.info("Dead-letter arrival on {}: message {}", entry.sourceQueue(), entry.messageId());
    }

    public void recordMetric(String metric, double value) {
        metrics.record(metric, value);
    }

    /**
     * Evaluate every alarm now and dispatch notifications for new breaches.
     *
     * @return notifications dispatched
     */
    public synchronized List<AlarmNotification> evaluate() {
        Instant now = clock.instant();
        List<AlarmNotification> dispatched = new ArrayList<>();
        Duration longestWindow = Duration.ZERO;

        for (Alarm alarm : alarms.values()) {
            AlarmDefinition definition = alarm.definition();
            if (definition.evaluationWindow().compareTo(longestWindow) > 0) {
                longestWindow = definition.evaluationWindow();
            }
            double value = metrics.sum(definition.metric(), definition.evaluationWindow());
            AlarmState before = alarm.state();
            Optional<AlarmNotification> notification = alarm.evaluate(value, now);
            notification.ifPresent(n -> {
                dispatch(n);
                dispatched.add(n);
            });
            if (before == AlarmState.ALARM && alarm.state() == AlarmState.OK) {
                log.info("Alarm {} back to OK ({} = {})", definition.name(), definition.metric(), value);
            }
        }

        if (!longestWindow.isZero()) {
            metrics.prune(longestWindow);
        }
        return dispatched;
    }

    private void dispatch(AlarmNotification notification) {
        for (NotificationChannel channel : channels) {
            try {
                channel.send(notification);
            } catch (RuntimeException e) {
                log.warn("Notification channel {} failed for alarm {}: {}",
                    channel.getClass().getSimpleName(), notification.alarmName(), e.getMessage());
            }
        }
    }

    /**
     * Start periodic evaluation.
     *
     * @param interval time between evaluations
     */
    public synchronized void start(Duration interval) {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-alerting");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = interval.toMillis();
        executor.scheduleWithFixedDelay(this::safeEvaluate, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Alerting started with {} alarms, evaluation interval {}ms", alarms.size(), intervalMs);
    }

    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private void safeEvaluate() {
        try {
            evaluate();
        } catch (RuntimeException e) {
            log.warn("Alarm evaluation failed: {}", e.getMessage(), e);
        }
    }
}
