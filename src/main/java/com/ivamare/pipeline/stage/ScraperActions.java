package com.ivamare.pipeline.stage;

import com.ivamare.pipeline.handler.Action;
import com.ivamare.pipeline.handler.ActionContext;
import com.ivamare.pipeline.model.ActionMessage;
import com.ivamare.pipeline.queue.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Handlers of the scraper queue.
 *
 * <p>Work items for the NLP stage are staged on the context, so they are only enqueued
 * once ingestion has finished and before the trigger is acknowledged.
 */
public class ScraperActions {

    private static final Logger log = LoggerFactory.getLogger(ScraperActions.class);

    static final int URL_CHUNK_SIZE = 500;

    private final IngestionService ingestionService;
    private final DocumentSource documentSource;

    public ScraperActions(IngestionService ingestionService, DocumentSource documentSource) {
        this.ingestionService = ingestionService;
        this.documentSource = documentSource;
    }

    @Action(queue = QueueNames.SCRAPER_QUEUE, name = PipelineActions.INGEST)
    public void ingest(ActionMessage message, ActionContext context) throws Exception {
        IngestionResult result = ingestionService.ingest(message.payload());
        log.info("Ingestion finished: {} new, {} updated (delivery {})",
            result.newIds().size(), result.updatedIds().size(), context.deliveryCount());
        forward(result, context);
    }

    @Action(queue = QueueNames.SCRAPER_QUEUE, name = PipelineActions.CHUNK_URLS)
    public void chunkUrls(ActionMessage message, ActionContext context) throws Exception {
        if (documentSource == null) {
            throw new IllegalStateException("No DocumentSource configured for " + PipelineActions.CHUNK_URLS);
        }
        List<String> urls = documentSource.listUrls(message.payload());
        int chunks = 0;
        for (int start = 0; start < urls.size(); start += URL_CHUNK_SIZE) {
            Map<String, Object> payload = new HashMap<>(message.payload());
            payload.put("urls", List.copyOf(urls.subList(start, Math.min(start + URL_CHUNK_SIZE, urls.size()))));
            context.send(QueueNames.SCRAPER_QUEUE, PipelineActions.INGEST_BILLS, payload);
            chunks++;
        }
        log.info("Split {} URLs into {} chunks", urls.size(), chunks);
    }

    @Action(queue = QueueNames.SCRAPER_QUEUE, name = PipelineActions.INGEST_BILLS)
    public void ingestBills(ActionMessage message, ActionContext context) throws Exception {
        List<String> urls = Payloads.strings(message.payload(), "urls");
        if (urls.isEmpty()) {
            log.warn("No URLs in {} message {}", PipelineActions.INGEST_BILLS, context.messageId());
            return;
        }
        IngestionResult result = ingestionService.ingestUrls(urls);
        log.info("Ingested chunk of {} URLs: {} new, {} updated",
            urls.size(), result.newIds().size(), result.updatedIds().size());
        forward(result, context);
    }

    private static void forward(IngestionResult result, ActionContext context) {
        if (!result.newIds().isEmpty()) {
            context.send(QueueNames.NLP_QUEUE, PipelineActions.EVENT_EXTRACTOR,
                Map.of("ids", result.newIds(), "type", PipelineActions.TYPE_NEW));
        }
        if (!result.updatedIds().isEmpty()) {
            context.send(QueueNames.NLP_QUEUE, PipelineActions.EVENT_EXTRACTOR,
                Map.of("ids", result.updatedIds(), "type", PipelineActions.TYPE_UPDATED));
        }
    }
}
