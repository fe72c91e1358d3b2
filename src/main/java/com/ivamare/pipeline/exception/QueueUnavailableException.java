package com.ivamare.pipeline.exception;

/**
 * Raised when the queue backend cannot be reached or rejects an operation.
 *
 * <p>Enqueue is all-or-nothing: when this is thrown from {@code enqueue} no message
 * was stored.
 */
public class QueueUnavailableException extends PipelineException {

    private final String queueName;

    public QueueUnavailableException(String queueName, String message, Throwable cause) {
        super("Queue " + queueName + " unavailable: " + message, cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
