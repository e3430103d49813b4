package com.heronix.attendance.model.enums;

/**
 * How the reporting window used for alerting is derived.
 */
public enum WindowMode {

    /**
     * Fixed historical range with explicit start and end dates
     */
    FIXED,

    /**
     * Rolling range of N days ending today
     */
    TRAILING
}
