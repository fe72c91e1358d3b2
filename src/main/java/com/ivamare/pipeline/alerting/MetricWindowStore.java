package com.ivamare.pipeline.alerting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Timestamped data points per metric, aggregated as a Sum over a trailing window.
 *
 * <p>Every record drops the points of its metric older than the retention, so the store
 * stays bounded even when nothing evaluates it. Alarms widen the retention to their window
 * through {@link #retainAtLeast(Duration)}.
 */
public class MetricWindowStore {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final Clock clock;
    private final Map<String, Deque<DataPoint>> series = new ConcurrentHashMap<>();
    private volatile Duration retention;

    public MetricWindowStore(Clock clock) {
        this(clock, DEFAULT_RETENTION);
    }

    public MetricWindowStore(Clock clock, Duration retention) {
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("Metric retention must be positive: " + retention);
        }
        this.clock = clock;
        this.retention = retention;
    }

    public Duration retention() {
        return retention;
    }

    /**
     * Widen the retention so sums over {@code window} stay complete. Never narrows it.
     */
    public synchronized void retainAtLeast(Duration window) {
        if (window != null && window.compareTo(retention) > 0) {
            retention = window;
        }
    }

    public void record(String metric) {
        record(metric, 1.0);
    }

    public void record(String metric, double value) {
        Deque<DataPoint> points = series.computeIfAbsent(metric, key -> new ArrayDeque<>());
        Instant now = clock.instant();
        synchronized (points) {
            dropOlderThan(points, now.minus(retention));
            points.addLast(new DataPoint(now, value));
        }
    }

    /**
     * Sum of the data points recorded within {@code window} before now.
     *
     * @param metric metric name
     * @param window trailing window
     * @return the Sum, 0 if nothing was recorded
     */
    public double sum(String metric, Duration window) {
        Deque<DataPoint> points = series.get(metric);
        if (points == null) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(window);
        double sum = 0;
        synchronized (points) {
            for (DataPoint point : points) {
                if (point.timestamp.isAfter(cutoff)) {
                    sum += point.value;
                }
            }
        }
        return sum;
    }

    /**
     * Drop data points older than {@code retention}.
     *
     * @param retention how far back data points are kept
     */
    public void prune(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        for (Deque<DataPoint> points : series.values()) {
            synchronized (points) {
                dropOlderThan(points, cutoff);
            }
        }
    }

    public Set<String> metrics() {
        return Set.copyOf(series.keySet());
    }

    /**
     * Number of data points held across all metrics.
     */
    public int pointCount() {
        int count = 0;
        for (Deque<DataPoint> points : series.values()) {
            synchronized (points) {
                count += points.size();
            }
        }
        return count;
    }

    // points are appended in clock order, so the old ones sit at the head
    private static void dropOlderThan(Deque<DataPoint> points, Instant cutoff) {
        Iterator<DataPoint> it = points.iterator();
        while (it.hasNext() && !it.next().timestamp.isAfter(cutoff)) {
            it.remove();
        }
    }

    private record DataPoint(Instant timestamp, double value) {
    }
}
