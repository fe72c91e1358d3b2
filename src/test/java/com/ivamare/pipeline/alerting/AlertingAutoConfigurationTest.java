package com.ivamare.pipeline.alerting;

import com.ivamare.pipeline.PipelineAutoConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("AlertingAutoConfiguration")
class AlertingAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(PipelineAutoConfiguration.class, AlertingAutoConfiguration.class));

    @Test
    @DisplayName("should create one alarm per log filter and per dead-letter queue")
    void shouldCreateDefaultAlarms() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AlertingSink.class);
            assertThat(context).hasSingleBean(LoggingNotificationChannel.class);
            assertThat(context).hasSingleBean(ErrorLogAppender.class);

            AlertingSink sink = context.getBean(AlertingSink.class);
            assertThat(sink.alarms())
                .extracting(alarm -> alarm.definition().name())
                .containsExactlyInAnyOrder(
                    "ErrorAlarm",
                    "TotalRequeryErrorAlarm",
                    "ScheduleRuleCreationErrorAlarm",
                    "SchedulerFailureAlarm",
                    "DeadLetter.scraper-queueAlarm",
                    "DeadLetter.nlp-queueAlarm");
            assertThat(sink.alarm("ErrorAlarm").orElseThrow().definition().evaluationWindow()).isEqualTo(Duration.ofHours(20));
        });
    }

    @Test
    @DisplayName("should apply window and threshold from properties")
    void shouldApplyProperties() {
        contextRunner
            .withPropertyValues(
                "pipeline.alerting.evaluation-window=30m",
                "pipeline.alerting.threshold=3")
            .run(context -> {
                AlarmDefinition definition = context.getBean(AlertingSink.class)
                    .alarm("DeadLetter.nlp-queueAlarm").orElseThrow().definition();
                assertThat(definition.evaluationWindow()).isEqualTo(Duration.ofMinutes(30));
                assertThat(definition.threshold()).isEqualTo(3.0);
            });
    }

    @Test
    @DisplayName("should use a custom notification channel instead of the logging one")
    void shouldUseCustomChannel() {
        contextRunner
            .withUserConfiguration(CustomChannelConfig.class)
            .run(context -> {
                assertThat(context).doesNotHaveBean(LoggingNotificationChannel.class);
                assertThat(context).getBean(NotificationChannel.class).isSameAs(CustomChannelConfig.CUSTOM);
            });
    }

    @Test
    @DisplayName("should skip log capture when disabled")
    void shouldSkipLogCapture() {
        contextRunner
            .withPropertyValues("pipeline.alerting.log-capture=false")
            .run(context -> {
                assertThat(context).hasSingleBean(AlertingSink.class);
                assertThat(context).doesNotHaveBean(ErrorLogAppender.class);
            });
    }

    @Test
    @DisplayName("should not create beans when alerting disabled")
    void shouldNotCreateWhenDisabled() {
        contextRunner
            .withPropertyValues("pipeline.alerting.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(AlertingSink.class);
                assertThat(context).doesNotHaveBean(MetricWindowStore.class);
                assertThat(context).doesNotHaveBean(ErrorLogAppender.class);
            });
    }

    @Configuration
    static class CustomChannelConfig {
        static final NotificationChannel CUSTOM = mock(NotificationChannel.class);

        @Bean
        public NotificationChannel notificationChannel() {
            return CUSTOM;
        }
    }
}
