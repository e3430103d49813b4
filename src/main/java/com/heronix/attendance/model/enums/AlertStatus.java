package com.heronix.attendance.model.enums;

/**
 * Lifecycle of an alert record.
 */
public enum AlertStatus {

    /**
     * Claimed by a dispatcher, notifier call in progress
     */
    PENDING,

    /**
     * Notifier succeeded
     */
    SENT
}
