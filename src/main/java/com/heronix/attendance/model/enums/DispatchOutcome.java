package com.heronix.attendance.model.enums;

/**
 * Result of one alert dispatch attempt.
 */
public enum DispatchOutcome {

    /**
     * Notifier accepted the alert and the alert record was committed
     */
    SENT,

    /**
     * An alert for the same student, course and window already exists (or is in flight)
     */
    SKIPPED_DUPLICATE,

    /**
     * Notifier failed; no alert record was kept so a later run can retry
     */
    FAILED
}
