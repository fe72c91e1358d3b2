package com.ivamare.pipeline.handler;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as the handler of one action on one queue.
 *
 * <p>Annotated methods on Spring beans are registered by the ActionRegistry. They must
 * have the signature:
 * <pre>
 * void handleXxx(ActionMessage message, ActionContext context)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class IngestActions {
 *
 *     {@literal @}Action(queue = "scraper-queue", name = "e_ingest")
 *     public void ingest(ActionMessage message, ActionContext context) {
 *         for (String id : ingestion.ingest()) {
 *             context.send("nlp-queue", new ActionMessage("e_event_extractor", Map.of("id", id)));
 *         }
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Action {

    /**
     * Queue the action arrives on.
     *
     * @return queue name (e.g., "scraper-queue")
     */
    String queue();

    /**
     * Action tag in the message envelope.
     *
     * @return action name (e.g., "e_ingest")
     */
    String name();
}
