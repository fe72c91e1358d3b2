package com.ivamare.pipeline.exception;

/**
 * Raised when attempting to register a duplicate action handler.
 */
public class HandlerAlreadyRegisteredException extends PipelineException {

    private final String queueName;
    private final String action;

    public HandlerAlreadyRegisteredException(String queueName, String action) {
        super("Handler already registered for " + queueName + "." + action);
        this.queueName = queueName;
        this.action = action;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getAction() {
        return action;
    }
}
