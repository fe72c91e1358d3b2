package com.ivamare.pipeline.exception;

import java.util.List;

/**
 * Fatal startup error: missing credentials, unknown queues, inconsistent settings.
 *
 * <p>Never handled by the pipeline itself; the process is expected to exit.
 */
public class PipelineConfigurationException extends PipelineException {

    private final List<String> problems;

    public PipelineConfigurationException(List<String> problems) {
        super("Invalid pipeline configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
