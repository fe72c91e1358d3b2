package com.ivamare.pipeline.alerting;

/**
 * Operator notification target (email, chat, pager).
 */
@FunctionalInterface
public interface NotificationChannel {

    /**
     * Deliver one notification. Exceptions are logged by the caller and do not
     * affect other channels.
     *
     * @param notification the alarm transition
     */
    void send(AlarmNotification notification);
}
