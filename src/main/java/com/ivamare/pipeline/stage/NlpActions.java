package com.ivamare.pipeline.stage;

import com.ivamare.pipeline.handler.Action;
import com.ivamare.pipeline.handler.ActionContext;
import com.ivamare.pipeline.model.ActionMessage;
import com.ivamare.pipeline.queue.QueueNames;
import com.ivamare.pipeline.scheduler.PipelineScheduler;
import com.ivamare.pipeline.scheduler.ScheduleRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Handlers of the NLP queue.
 *
 * <p>Analysis is a two-step batch: {@code e_event_extractor} submits and registers a
 * polling rule, {@code e_event_retriever} is enqueued by that rule until the batch
 * reaches a final status.
 */
public class NlpActions {

    private static final Logger log = LoggerFactory.getLogger(NlpActions.class);

    static final String BATCH_RULE_PREFIX = "batch-check-";

    /** Older producers name the document ids {@code bill_ids}. */
    static final String LEGACY_IDS_FIELD = "bill_ids";

    private final AnalysisService analysisService;
    private final ResultStore resultStore;
    private final PipelineScheduler scheduler;
    private final String batchCheckSchedule;

    public NlpActions(AnalysisService analysisService,
                      ResultStore resultStore,
                      PipelineScheduler scheduler,
                      String batchCheckSchedule) {
        this.analysisService = analysisService;
        this.resultStore = resultStore;
        this.scheduler = scheduler;
        this.batchCheckSchedule = batchCheckSchedule;
    }

    public static String batchRuleName(String batchId) {
        return BATCH_RULE_PREFIX + batchId;
    }

    @Action(queue = QueueNames.NLP_QUEUE, name = PipelineActions.EVENT_EXTRACTOR)
    public void extract(ActionMessage message, ActionContext context) throws Exception {
        List<String> ids = Payloads.strings(message.payload(), "ids");
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("No document ids in " + PipelineActions.EVENT_EXTRACTOR + " payload");
        }
        String type = Payloads.string(message.payload(), "type", PipelineActions.TYPE_NEW);

        String batchId = analysisService.submit(ids, type);
        log.info("Submitted analysis batch {} for {} documents (type={})", batchId, ids.size(), type);

        try {
            scheduler.register(ScheduleRule.of(
                batchRuleName(batchId),
                batchCheckSchedule,
                QueueNames.NLP_QUEUE,
                new ActionMessage(PipelineActions.EVENT_RETRIEVER, Map.of("batch_id", batchId, "ids", ids))));
        } catch (RuntimeException e) {
            // the batch is submitted; a redelivery would pay for it twice
            log.error("Error creating schedule rule for batch {}: {}", batchId, e.getMessage());
        }
    }

    @Action(queue = QueueNames.NLP_QUEUE, name = PipelineActions.EVENT_RETRIEVER)
    public void retrieve(ActionMessage message, ActionContext context) throws Exception {
        String batchId = Payloads.string(message.payload(), "batch_id", null);
        if (batchId == null) {
            throw new IllegalArgumentException("No batch_id in " + PipelineActions.EVENT_RETRIEVER + " payload");
        }
        List<String> ids = Payloads.strings(message.payload(), "ids", LEGACY_IDS_FIELD);

        BatchResult result = analysisService.poll(batchId);
        switch (result.status()) {
            case NOT_READY -> log.debug("Batch {} not ready yet", batchId);
            case COMPLETED -> {
                commit(result);
                cleanup(batchId);
                if (!result.failedIds().isEmpty()) {
                    log.info("Retrying {} failed documents from batch {}", result.failedIds().size(), batchId);
                    resubmit(context, result.failedIds());
                }
            }
            case ERRORED, EXPIRED -> {
                log.warn("Batch {} {}, retrying all {} documents", batchId, result.status(), ids.size());
                cleanup(batchId);
                resubmit(context, ids);
            }
            case CANCELLED -> {
                log.info("Batch {} was cancelled", batchId);
                cleanup(batchId);
            }
        }
    }

    private void commit(BatchResult result) throws Exception {
        try {
            resultStore.commit(result);
            log.info("Committed results of batch {}", result.batchId());
        } catch (Exception e) {
            log.error("Logging error for batch {}: {}", result.batchId(), e.getMessage());
            throw e;
        }
    }

    private void cleanup(String batchId) {
        scheduler.remove(batchRuleName(batchId));
    }

    private static void resubmit(ActionContext context, List<String> ids) {
        if (!ids.isEmpty()) {
            context.send(QueueNames.NLP_QUEUE, PipelineActions.EVENT_EXTRACTOR,
                Map.of("ids", ids, "type", PipelineActions.TYPE_NEW));
        }
    }
}
