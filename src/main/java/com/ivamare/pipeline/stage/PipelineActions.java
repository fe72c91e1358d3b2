package com.ivamare.pipeline.stage;

/**
 * Action tags of the two stages.
 */
public final class PipelineActions {

    /** Scheduled ingestion trigger on the scraper queue. */
    public static final String INGEST = "e_ingest";

    /** Fan a document listing out into {@link #INGEST_BILLS} chunks. */
    public static final String CHUNK_URLS = "e_chunk_urls";

    /** Ingest one chunk of document URLs. */
    public static final String INGEST_BILLS = "e_ingest_bills";

    /** Submit documents for analysis on the NLP queue. */
    public static final String EVENT_EXTRACTOR = "e_event_extractor";

    /** Poll a submitted analysis batch. */
    public static final String EVENT_RETRIEVER = "e_event_retriever";

    public static final String TYPE_NEW = "new_bill";
    public static final String TYPE_UPDATED = "updated_bill";

    private PipelineActions() {
    }
}
