package com.ivamare.pipeline;

import com.ivamare.pipeline.exception.PipelineConfigurationException;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.queue.QueueRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup when the pipeline cannot work: required credentials or endpoints
 * missing, or a stage queue not configured.
 */
public class PipelineConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigurationValidator.class);

    private final Environment environment;
    private final PipelineProperties properties;
    private final QueueRegistry queueRegistry;

    public PipelineConfigurationValidator(Environment environment,
                                          PipelineProperties properties,
                                          QueueRegistry queueRegistry) {
        this.environment = environment;
        this.properties = properties;
        this.queueRegistry = queueRegistry;
    }

    @PostConstruct
    public void validate() {
        List<String> problems = new ArrayList<>();

        for (String key : properties.getEnvironment().getRequired()) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + " is required but not set");
            }
        }

        for (String queue : List.of(QueueNames.SCRAPER_QUEUE, QueueNames.NLP_QUEUE)) {
            if (!queueRegistry.contains(queue)) {
                problems.add("queue " + queue + " is not configured");
            }
        }

        if (properties.getWorker().getConcurrency() < 1) {
            problems.add("pipeline.worker.concurrency must be at least 1");
        }

        if (!problems.isEmpty()) {
            throw new PipelineConfigurationException(problems);
        }
        log.info("Pipeline configuration validated ({} queues, backend={})",
            queueRegistry.all().size(), properties.getQueueBackend());
    }
}
