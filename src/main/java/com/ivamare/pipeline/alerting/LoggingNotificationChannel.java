package com.ivamare.pipeline.alerting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log. Used when no other channel is configured.
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    @Override
    public void send(AlarmNotification notification) {
        log.warn("ALARM {}", notification.summary());
    }
}
