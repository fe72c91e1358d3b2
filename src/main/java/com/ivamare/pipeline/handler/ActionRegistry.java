package com.ivamare.pipeline.handler;

import com.ivamare.pipeline.model.ActionMessage;

import java.util.List;
import java.util.Optional;

/**
 * Registry mapping (queue, action) pairs to handlers.
 *
 * <p>Each worker dispatches through this registry; a message whose action has no
 * entry is a poison message for that queue.
 */
public interface ActionRegistry {

    /**
     * Register a handler.
     *
     * @param queueName The queue (e.g., "nlp-queue")
     * @param action The action tag (e.g., "e_event_retriever")
     * @param handler The handler
     * @throws com.ivamare.pipeline.exception.HandlerAlreadyRegisteredException if one exists
     */
    void register(String queueName, String action, ActionHandler handler);

    Optional<ActionHandler> get(String queueName, String action);

    boolean hasHandler(String queueName, String action);

    /**
     * Dispatch a message to its handler.
     *
     * @param message The envelope
     * @param context Handler context
     * @throws com.ivamare.pipeline.exception.UnsupportedActionException if the action is
     *         missing or has no handler on the context's queue
     * @throws Exception from the handler
     */
    void dispatch(ActionMessage message, ActionContext context) throws Exception;

    /**
     * Actions registered for a queue.
     *
     * @param queueName The queue
     * @return action tags
     */
    List<String> actionsFor(String queueName);

    List<ActionKey> registeredActions();

    /**
     * Scan a bean for {@link Action} methods and register them.
     *
     * @param bean The bean to scan
     * @return keys registered
     */
    List<ActionKey> registerBean(Object bean);

    /**
     * Key for handler lookup.
     *
     * @param queueName The queue
     * @param action The action tag
     */
    record ActionKey(String queueName, String action) {}
}
