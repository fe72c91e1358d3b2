package com.ivamare.pipeline.health;

import com.ivamare.pipeline.PipelineAutoConfiguration;
import com.ivamare.pipeline.queue.QueueRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for pipeline health indicators.
 */
@AutoConfiguration(after = PipelineAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(QueueRegistry.class)
    @ConditionalOnMissingBean(QueueHealthIndicator.class)
    public QueueHealthIndicator queueHealthIndicator(QueueRegistry queueRegistry) {
        return new QueueHealthIndicator(queueRegistry);
    }
}
