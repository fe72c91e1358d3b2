package com.ivamare.pipeline.queue;

/**
 * Queue naming conventions.
 */
public final class QueueNames {

    /** Ingestion trigger queue. */
    public static final String SCRAPER_QUEUE = "scraper-queue";

    /** Analysis work-item queue. */
    public static final String NLP_QUEUE = "nlp-queue";

    private static final String DLQ_SUFFIX = "_dlq";

    private QueueNames() {
    }

    /**
     * Dead-letter queue name for a source queue.
     *
     * @param queueName source queue
     * @return dead-letter queue name
     */
    public static String deadLetterQueue(String queueName) {
        return queueName + DLQ_SUFFIX;
    }

    /**
     * PGMQ-safe identifier for a logical queue name. Only alphanumerics and underscores
     * survive; everything else becomes an underscore.
     *
     * @param queueName logical queue name
     * @return PGMQ queue name
     */
    public static String pgmqName(String queueName) {
        return queueName.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    /**
     * PGMQ table that holds the messages of a queue.
     *
     * @param queueName logical queue name
     * @return schema-qualified table name
     */
    public static String pgmqTable(String queueName) {
        return "pgmq.q_" + pgmqName(queueName);
    }
}
