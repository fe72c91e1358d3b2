package com.ivamare.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pipeline.handler.impl.DefaultActionRegistry;
import com.ivamare.pipeline.handler.ActionRegistry;
import com.ivamare.pipeline.model.ActionMessage;
import com.ivamare.pipeline.queue.DeadLetterOperations;
import com.ivamare.pipeline.queue.MessageQueue;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueRegistry;
import com.ivamare.pipeline.queue.QueueSettings;
import com.ivamare.pipeline.queue.impl.DefaultDeadLetterOperations;
import com.ivamare.pipeline.queue.impl.InMemoryMessageQueue;
import com.ivamare.pipeline.queue.impl.JdbcDeadLetterQueue;
import com.ivamare.pipeline.queue.impl.PgmqMessageQueue;
import com.ivamare.pipeline.scheduler.PipelineScheduler;
import com.ivamare.pipeline.scheduler.ScheduleExpression;
import com.ivamare.pipeline.scheduler.ScheduleRule;
import com.ivamare.pipeline.scheduler.ScheduleRuleStore;
import com.ivamare.pipeline.scheduler.impl.InMemoryScheduleRuleStore;
import com.ivamare.pipeline.scheduler.impl.JdbcScheduleRuleStore;
import com.ivamare.pipeline.stage.AnalysisService;
import com.ivamare.pipeline.stage.DocumentSource;
import com.ivamare.pipeline.stage.IngestionService;
import com.ivamare.pipeline.stage.NlpActions;
import com.ivamare.pipeline.stage.PipelineActions;
import com.ivamare.pipeline.stage.ResultStore;
import com.ivamare.pipeline.stage.ScraperActions;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Auto-configuration for the pipeline.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Queues (in-memory or PGMQ) and their dead-letter queues</li>
 *   <li>Action Registry</li>
 *   <li>Dead-letter operations</li>
 *   <li>Scheduler with the daily ingestion rule, its rules stored in the database on PGMQ</li>
 *   <li>Scraper and NLP stage handlers, when their collaborators are present</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * pipeline.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineAutoConfiguration.class);

    static final String INGEST_RULE_NAME = "scraper-daily";

    // --- Infrastructure ---

    @Bean
    @ConditionalOnMissingBean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper pipelineObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    // --- Queues ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "pipeline", name = "queue-backend", havingValue = "memory", matchIfMissing = true)
    static class InMemoryQueueConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public QueueRegistry queueRegistry(PipelineProperties properties, Clock clock) {
            List<MessageQueue> queues = new ArrayList<>();
            properties.getQueues().forEach((name, queue) ->
                queues.add(new InMemoryMessageQueue(name, queue.toSettings(), clock)));
            log.info("Configured {} in-memory queues: {}", queues.size(), properties.getQueues().keySet());
            return new QueueRegistry(queues);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "pipeline", name = "queue-backend", havingValue = "pgmq")
    static class PgmqQueueConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public QueueRegistry queueRegistry(PipelineProperties properties,
                                           JdbcTemplate jdbcTemplate,
                                           PlatformTransactionManager transactionManager,
                                           ObjectMapper objectMapper,
                                           Clock clock) {
            TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
            boolean initialize = properties.getPgmq().isInitializeSchema();
            List<MessageQueue> queues = new ArrayList<>();

            for (Map.Entry<String, PipelineProperties.QueueProperties> entry : properties.getQueues().entrySet()) {
                String name = entry.getKey();
                QueueSettings settings = entry.getValue().toSettings();
                JdbcDeadLetterQueue deadLetterQueue = new JdbcDeadLetterQueue(
                    QueueNames.deadLetterQueue(name), name, settings.deadLetterRetention(),
                    jdbcTemplate, objectMapper, clock);
                PgmqMessageQueue queue = new PgmqMessageQueue(
                    name, settings, deadLetterQueue, jdbcTemplate, transactionTemplate, objectMapper, clock);

                if (initialize) {
                    if (queues.isEmpty()) {
                        deadLetterQueue.createTable();
                    }
                    queue.createQueue();
                }
                queues.add(queue);
            }
            log.info("Configured {} PGMQ queues: {}", queues.size(), properties.getQueues().keySet());
            return new QueueRegistry(queues);
        }

        @Bean
        @ConditionalOnProperty(prefix = "pipeline.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
        @ConditionalOnMissingBean
        public ScheduleRuleStore scheduleRuleStore(PipelineProperties properties,
                                                   JdbcTemplate jdbcTemplate,
                                                   ObjectMapper objectMapper) {
            JdbcScheduleRuleStore store = new JdbcScheduleRuleStore(jdbcTemplate, objectMapper);
            if (properties.getPgmq().isInitializeSchema()) {
                store.createTable();
            }
            return store;
        }
    }

    // --- Action Registry ---

    @Bean
    @ConditionalOnMissingBean(ActionRegistry.class)
    public static DefaultActionRegistry actionRegistry() {
        return new DefaultActionRegistry();
    }

    // --- Dead-Letter Operations ---

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterOperations deadLetterOperations(QueueRegistry queueRegistry) {
        return new DefaultDeadLetterOperations(queueRegistry);
    }

    // --- Configuration Validation ---

    @Bean
    @ConditionalOnMissingBean
    public PipelineConfigurationValidator pipelineConfigurationValidator(Environment environment,
                                                                         PipelineProperties properties,
                                                                         QueueRegistry queueRegistry) {
        return new PipelineConfigurationValidator(environment, properties, queueRegistry);
    }

    // --- Scheduler ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "pipeline.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulerConfiguration {

        private final PipelineProperties properties;

        SchedulerConfiguration(PipelineProperties properties) {
            this.properties = properties;
        }

        @Bean(destroyMethod = "stop")
        @ConditionalOnMissingBean
        public PipelineScheduler pipelineScheduler(QueueRegistry queueRegistry,
                                                   ObjectProvider<ScheduleRuleStore> ruleStore,
                                                   Clock clock,
                                                   ObjectProvider<MeterRegistry> meterRegistry) {
            PipelineScheduler scheduler = new PipelineScheduler(queueRegistry,
                ruleStore.getIfAvailable(InMemoryScheduleRuleStore::new),
                clock, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
            PipelineProperties.SchedulerProperties sp = properties.getScheduler();

            String ingestSchedule = sp.getIngestSchedule();
            if (ingestSchedule != null && !ingestSchedule.isBlank()) {
                scheduler.registerOrReplace(ScheduleRule.of(INGEST_RULE_NAME, ingestSchedule,
                    QueueNames.SCRAPER_QUEUE, ActionMessage.of(PipelineActions.INGEST)));
            }
            for (PipelineProperties.RuleProperties rule : sp.getRules()) {
                scheduler.registerOrReplace(new ScheduleRule(
                    rule.getName(),
                    ScheduleExpression.parse(rule.getSchedule()),
                    rule.getTargetQueue(),
                    new ActionMessage(rule.getAction(), rule.getPayload()).toMap()));
            }
            return scheduler;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void startScheduler(ApplicationReadyEvent event) {
            if (properties.getScheduler().isAutoStart()) {
                event.getApplicationContext().getBean(PipelineScheduler.class)
                    .start(Duration.ofMillis(properties.getScheduler().getTickIntervalMs()));
            }
        }
    }

    // --- Stages ---

    @Bean
    @ConditionalOnBean(IngestionService.class)
    @ConditionalOnMissingBean
    public ScraperActions scraperActions(IngestionService ingestionService,
                                         ObjectProvider<DocumentSource> documentSource) {
        return new ScraperActions(ingestionService, documentSource.getIfAvailable());
    }

    @Bean
    @ConditionalOnBean({AnalysisService.class, ResultStore.class, PipelineScheduler.class})
    @ConditionalOnMissingBean
    public NlpActions nlpActions(AnalysisService analysisService,
                                 ResultStore resultStore,
                                 PipelineScheduler scheduler,
                                 PipelineProperties properties) {
        return new NlpActions(analysisService, resultStore, scheduler,
            properties.getScheduler().getBatchCheckSchedule());
    }
}
