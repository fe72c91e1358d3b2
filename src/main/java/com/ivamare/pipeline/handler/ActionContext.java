package com.ivamare.pipeline.handler;

import com.ivamare.pipeline.model.ActionMessage;
import com.ivamare.pipeline.model.OutboundMessage;
import com.ivamare.pipeline.model.QueueMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Context provided to action handlers while one delivery is processed.
 *
 * <p>Downstream messages are staged here rather than enqueued directly, so the worker
 * can enqueue them all before acknowledging the delivery that produced them.
 */
public final class ActionContext {

    private final String queueName;
    private final QueueMessage message;
    private final int maxReceiveCount;
    private final VisibilityExtender visibilityExtender;
    private final List<OutboundMessage> outbound = new ArrayList<>();

    /**
     * @param queueName Queue the message was received from
     * @param message The delivery being processed
     * @param maxReceiveCount Receive budget of the queue
     * @param visibilityExtender Function to extend the lease (nullable)
     */
    public ActionContext(String queueName, QueueMessage message, int maxReceiveCount,
                         VisibilityExtender visibilityExtender) {
        this.queueName = queueName;
        this.message = message;
        this.maxReceiveCount = maxReceiveCount;
        this.visibilityExtender = visibilityExtender;
    }

    public String queueName() {
        return queueName;
    }

    public String messageId() {
        return message.messageId();
    }

    public int deliveryCount() {
        return message.deliveryCount();
    }

    /**
     * Check if this is the last delivery before the message is dead-lettered.
     *
     * @return true if a failure now sends the message to the dead-letter queue
     */
    public boolean isLastAttempt() {
        return message.deliveryCount() >= maxReceiveCount;
    }

    /**
     * Stage a downstream message.
     *
     * @param targetQueue Queue to enqueue to
     * @param outboundMessage Message envelope
     */
    public void send(String targetQueue, ActionMessage outboundMessage) {
        outbound.add(new OutboundMessage(targetQueue, outboundMessage));
    }

    /**
     * Stage a downstream message.
     *
     * @param targetQueue Queue to enqueue to
     * @param action Action tag
     * @param payload Action arguments
     */
    public void send(String targetQueue, String action, Map<String, Object> payload) {
        send(targetQueue, new ActionMessage(action, payload));
    }

    /**
     * Messages staged so far, in order.
     *
     * @return read-only view
     */
    public List<OutboundMessage> outbound() {
        return Collections.unmodifiableList(outbound);
    }

    /**
     * Push the visibility deadline of the current lease to now + {@code timeout}.
     *
     * @param timeout New visibility timeout
     * @return false if the lease was already lost
     * @throws IllegalStateException if no visibility extender is available
     */
    public boolean extendVisibility(Duration timeout) {
        if (visibilityExtender == null) {
            throw new IllegalStateException("Visibility extender not available");
        }
        return visibilityExtender.extend(timeout);
    }

    /**
     * Functional interface for extending message visibility.
     */
    @FunctionalInterface
    public interface VisibilityExtender {
        boolean extend(Duration timeout);
    }
}
