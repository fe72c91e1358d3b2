package com.ivamare.pipeline.exception;

/**
 * Raised when a queue name is not known to the {@link com.ivamare.pipeline.queue.QueueRegistry}.
 */
public class QueueNotFoundException extends PipelineException {

    private final String queueName;

    public QueueNotFoundException(String queueName) {
        super("Queue not found: " + queueName);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
