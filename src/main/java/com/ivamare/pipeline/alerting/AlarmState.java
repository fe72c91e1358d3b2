package com.ivamare.pipeline.alerting;

/**
 * State of an alarm. Notifications are sent only on {@code OK -> ALARM}.
 */
public enum AlarmState {
    OK,
    ALARM
}
