package com.ivamare.pipeline.handler;

import com.ivamare.pipeline.model.ActionMessage;

/**
 * Functional interface for action handlers.
 *
 * <p>A handler that returns normally has succeeded: the worker enqueues whatever the
 * handler staged through {@link ActionContext#send} and then acknowledges the message.
 * Any exception leaves the message leased; it is redelivered when the visibility
 * timeout expires and dead-lettered once its receive budget is spent.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Handle one message.
     *
     * @param message The parsed envelope
     * @param context Delivery details and outbound staging
     * @throws Exception on any failure
     */
    void handle(ActionMessage message, ActionContext context) throws Exception;
}
