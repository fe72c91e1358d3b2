package com.ivamare.pipeline.exception;

/**
 * Raised when a message carries no action, or an action with no registered handler.
 *
 * <p>The worker does not special-case it: the message is left unacknowledged and
 * eventually lands in the dead-letter queue like any other poison message.
 */
public class UnsupportedActionException extends PipelineException {

    private final String queueName;
    private final String action;

    public UnsupportedActionException(String queueName, String action) {
        super("Unsupported action " + action + " on queue " + queueName);
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
