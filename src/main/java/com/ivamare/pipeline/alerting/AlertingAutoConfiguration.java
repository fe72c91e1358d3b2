package com.ivamare.pipeline.alerting;

import ch.qos.logback.classic.LoggerContext;
import com.ivamare.pipeline.PipelineAutoConfiguration;
import com.ivamare.pipeline.PipelineProperties;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Duration;

/**
 * Auto-configuration for the alerting sink.
 *
 * <p>Default alarms: one per log filter and one per dead-letter queue, each firing when
 * the Sum over {@code pipeline.alerting.evaluation-window} reaches
 * {@code pipeline.alerting.threshold}.
 */
@AutoConfiguration(after = PipelineAutoConfiguration.class)
@ConditionalOnProperty(prefix = "pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AlertingAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AlertingAutoConfiguration.class);

    private final PipelineProperties properties;

    public AlertingAutoConfiguration(PipelineProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(prefix = "pipeline.alerting", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean
    public MetricWindowStore metricWindowStore(Clock clock) {
        return new MetricWindowStore(clock, properties.getAlerting().getEvaluationWindow());
    }

    @Bean
    @ConditionalOnProperty(prefix = "pipeline.alerting", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean(NotificationChannel.class)
    public LoggingNotificationChannel loggingNotificationChannel() {
        return new LoggingNotificationChannel();
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "pipeline.alerting", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean
    public AlertingSink alertingSink(MetricWindowStore metrics,
                                     Clock clock,
                                     ObjectProvider<NotificationChannel> channels,
                                     QueueRegistry queueRegistry) {
        AlertingSink sink = new AlertingSink(metrics, clock, channels.orderedStream().toList());
        PipelineProperties.AlertingProperties ap = properties.getAlerting();
        Duration window = ap.getEvaluationWindow();

        for (LogPatternFilter filter : LogPatternFilter.defaults()) {
            sink.addAlarm(new AlarmDefinition(
                filter.metric() + "Alarm", filter.metric(), ap.getThreshold(), window,
                ComparisonOperator.GREATER_THAN_OR_EQUAL,
                "Log lines containing '" + filter.pattern() + "'"));
        }
        for (MessageQueue queue : queueRegistry.all()) {
            String metric = AlertingSink.deadLetterMetric(queue.name());
            sink.addAlarm(new AlarmDefinition(
                metric + "Alarm", metric, ap.getThreshold(), window,
                ComparisonOperator.GREATER_THAN_OR_EQUAL,
                "Messages dead-lettered from " + queue.name()));
            queue.deadLetterQueue().addListener(sink);
        }
        return sink;
    }

    @Bean(destroyMethod = "uninstall")
    @ConditionalOnClass(LoggerContext.class)
    @ConditionalOnProperty(prefix = "pipeline.alerting", name = {"enabled", "log-capture"},
        havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean
    public ErrorLogAppender errorLogAppender(MetricWindowStore metrics) {
        ErrorLogAppender appender = new ErrorLogAppender(metrics, LogPatternFilter.defaults());
        if (!appender.install()) {
            log.warn("Logging backend is not Logback, log-based alarms are disabled");
        }
        return appender;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startEvaluation(ApplicationReadyEvent event) {
        PipelineProperties.AlertingProperties ap = properties.getAlerting();
        if (ap.isEnabled() && ap.isAutoStart()) {
            event.getApplicationContext().getBeanProvider(AlertingSink.class)
                .ifAvailable(sink -> sink.start(Duration.ofMillis(ap.getEvaluationIntervalMs())));
        }
    }
}
