package com.ivamare.pipeline;

import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the pipeline.
 *
 * <p>Example configuration:
 * <pre>
 * pipeline:
 *   enabled: true
 *   queue-backend: pgmq
 *   pgmq:
 *     initialize-schema: true
 *   queues:
 *     scraper-queue:
 *       visibility-timeout: 1800
 *       max-receive-count: 5
 *       dead-letter-retention: 14d
 *   worker:
 *     auto-start: true
 *     concurrency: 1
 *     wait-timeout: 20s
 *     resilience:
 *       initial-backoff-ms: 1000
 *       max-backoff-ms: 60000
 *   scheduler:
 *     ingest-schedule: cron(0 0 10 * * *)
 *   alerting:
 *     evaluation-window: 20h
 *   environment:
 *     required: [pipeline.analysis.api-key, spring.datasource.url]
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Enable/disable pipeline auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Queue backend.
     */
    private QueueBackend queueBackend = QueueBackend.MEMORY;

    /**
     * Per-queue lease settings, keyed by logical queue name.
     */
    private Map<String, QueueProperties> queues = defaultQueues();

    private PgmqProperties pgmq = new PgmqProperties();

    private WorkerProperties worker = new WorkerProperties();

    private SchedulerProperties scheduler = new SchedulerProperties();

    private AlertingProperties alerting = new AlertingProperties();

    private EnvironmentProperties environment = new EnvironmentProperties();

    private static Map<String, QueueProperties> defaultQueues() {
        Map<String, QueueProperties> queues = new LinkedHashMap<>();
        queues.put(QueueNames.SCRAPER_QUEUE, QueueProperties.from(QueueSettings.scraperDefaults()));
        queues.put(QueueNames.NLP_QUEUE, QueueProperties.from(QueueSettings.nlpDefaults()));
        return queues;
    }

    public enum QueueBackend {
        MEMORY,
        PGMQ
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public QueueBackend getQueueBackend() {
        return queueBackend;
    }

    public void setQueueBackend(QueueBackend queueBackend) {
        this.queueBackend = queueBackend;
    }

    public Map<String, QueueProperties> getQueues() {
        return queues;
    }

    public void setQueues(Map<String, QueueProperties> queues) {
        this.queues = queues;
    }

    public PgmqProperties getPgmq() {
        return pgmq;
    }

    public void setPgmq(PgmqProperties pgmq) {
        this.pgmq = pgmq;
    }

    public WorkerProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerProperties worker) {
        this.worker = worker;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    public AlertingProperties getAlerting() {
        return alerting;
    }

    public void setAlerting(AlertingProperties alerting) {
        this.alerting = alerting;
    }

    public EnvironmentProperties getEnvironment() {
        return environment;
    }

    public void setEnvironment(EnvironmentProperties environment) {
        this.environment = environment;
    }

    /**
     * Lease settings of one queue.
     */
    public static class QueueProperties {

        /**
         * Visibility timeout in seconds.
         */
        private int visibilityTimeout = 30;

        /**
         * Deliveries allowed before the message is dead-lettered.
         */
        private int maxReceiveCount = 3;

        /**
         * How long dead-lettered messages are kept.
         */
        private Duration deadLetterRetention = Duration.ofDays(14);

        static QueueProperties from(QueueSettings settings) {
            QueueProperties properties = new QueueProperties();
            properties.setVisibilityTimeout(settings.visibilityTimeoutSeconds());
            properties.setMaxReceiveCount(settings.maxReceiveCount());
            properties.setDeadLetterRetention(settings.deadLetterRetention());
            return properties;
        }

        public QueueSettings toSettings() {
            return new QueueSettings(visibilityTimeout, maxReceiveCount, deadLetterRetention);
        }

        public int getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(int visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public int getMaxReceiveCount() {
            return maxReceiveCount;
        }

        public void setMaxReceiveCount(int maxReceiveCount) {
            this.maxReceiveCount = maxReceiveCount;
        }

        public Duration getDeadLetterRetention() {
            return deadLetterRetention;
        }

        public void setDeadLetterRetention(Duration deadLetterRetention) {
            this.deadLetterRetention = deadLetterRetention;
        }
    }

    /**
     * PGMQ backend settings.
     */
    public static class PgmqProperties {

        /**
         * Create the PGMQ queues and the dead-letter table on startup.
         */
        private boolean initializeSchema = true;

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    /**
     * Worker settings, shared by all queue workers.
     */
    public static class WorkerProperties {

        /**
         * Start a worker per queue with registered actions once the application is ready.
         */
        private boolean autoStart = false;

        /**
         * Polling loops per worker.
         */
        private int concurrency = 1;

        /**
         * Idle sleep between polls when wait-timeout is zero.
         */
        private int pollIntervalMs = 1000;

        /**
         * How long one receive blocks waiting for a message.
         */
        private Duration waitTimeout = Duration.ofSeconds(20);

        /**
         * Graceful shutdown timeout.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        private ResilienceProperties resilience = new ResilienceProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Duration getWaitTimeout() {
            return waitTimeout;
        }

        public void setWaitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public ResilienceProperties getResilience() {
            return resilience;
        }

        public void setResilience(ResilienceProperties resilience) {
            this.resilience = resilience;
        }
    }

    /**
     * Backoff applied when the queue backend is unavailable.
     */
    public static class ResilienceProperties {

        private long initialBackoffMs = 1000;

        private long maxBackoffMs = 60000;

        private double backoffMultiplier = 2.0;

        /**
         * Consecutive errors from which backoff messages are logged as errors.
         */
        private int errorThreshold = 5;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public int getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(int errorThreshold) {
            this.errorThreshold = errorThreshold;
        }
    }

    /**
     * Scheduler settings.
     */
    public static class SchedulerProperties {

        private boolean enabled = true;

        /**
         * Start ticking once the application is ready.
         */
        private boolean autoStart = false;

        private long tickIntervalMs = 1000;

        /**
         * Schedule of the daily ingestion trigger; blank disables the rule.
         */
        private String ingestSchedule = "cron(0 0 10 * * *)";

        /**
         * Schedule of the per-batch polling rules created by the analysis stage.
         */
        private String batchCheckSchedule = "rate(2 minutes)";

        /**
         * Additional static rules.
         */
        private List<RuleProperties> rules = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public long getTickIntervalMs() {
            return tickIntervalMs;
        }

        public void setTickIntervalMs(long tickIntervalMs) {
            this.tickIntervalMs = tickIntervalMs;
        }

        public String getIngestSchedule() {
            return ingestSchedule;
        }

        public void setIngestSchedule(String ingestSchedule) {
            this.ingestSchedule = ingestSchedule;
        }

        public String getBatchCheckSchedule() {
            return batchCheckSchedule;
        }

        public void setBatchCheckSchedule(String batchCheckSchedule) {
            this.batchCheckSchedule = batchCheckSchedule;
        }

        public List<RuleProperties> getRules() {
            return rules;
        }

        public void setRules(List<RuleProperties> rules) {
            this.rules = rules;
        }
    }

    /**
     * A static schedule rule.
     */
    public static class RuleProperties {

        private String name;

        private String schedule;

        private String targetQueue;

        private String action;

        private Map<String, Object> payload = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public String getTargetQueue() {
            return targetQueue;
        }

        public void setTargetQueue(String targetQueue) {
            this.targetQueue = targetQueue;
        }

        public String getAction() {
            return action;
        }

        public void setAction(String action) {
            this.action = action;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        public void setPayload(Map<String, Object> payload) {
            this.payload = payload;
        }
    }

    /**
     * Alerting settings.
     */
    public static class AlertingProperties {

        private boolean enabled = true;

        /**
         * Attach the error-log appender to the root logger.
         */
        private boolean logCapture = true;

        /**
         * Start periodic evaluation once the application is ready.
         */
        private boolean autoStart = false;

        private long evaluationIntervalMs = 60000;

        /**
         * Window of the default alarms.
         */
        private Duration evaluationWindow = Duration.ofHours(20);

        /**
         * Threshold of the default alarms.
         */
        private double threshold = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogCapture() {
            return logCapture;
        }

        public void setLogCapture(boolean logCapture) {
            this.logCapture = logCapture;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public long getEvaluationIntervalMs() {
            return evaluationIntervalMs;
        }

        public void setEvaluationIntervalMs(long evaluationIntervalMs) {
            this.evaluationIntervalMs = evaluationIntervalMs;
        }

        public Duration getEvaluationWindow() {
            return evaluationWindow;
        }

        public void setEvaluationWindow(Duration evaluationWindow) {
            this.evaluationWindow = evaluationWindow;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }
    }

    /**
     * Values that must be present for the process to start.
     */
    public static class EnvironmentProperties {

        /**
         * Property names (or environment variables) that must resolve to a non-blank value.
         */
        private List<String> required = new ArrayList<>();

        public List<String> getRequired() {
            return required;
        }

        public void setRequired(List<String> required) {
            this.required = required;
        }
    }
}
