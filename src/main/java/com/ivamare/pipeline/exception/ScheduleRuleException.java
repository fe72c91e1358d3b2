package com.ivamare.pipeline.exception;

/**
 * Raised when a schedule rule cannot be parsed or registered.
 */
public class ScheduleRuleException extends PipelineException {

    public ScheduleRuleException(String message) {
        super(message);
    }

    public ScheduleRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
