package com.ivamare.pipeline.model;

/**
 * A downstream message staged by a handler, enqueued by the worker before it
 * acknowledges the message being processed.
 *
 * @param queueName Target queue
 * @param message Message envelope
 */
public record OutboundMessage(String queueName, ActionMessage message) {
}
