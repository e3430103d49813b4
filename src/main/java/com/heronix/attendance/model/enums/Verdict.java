package com.heronix.attendance.model.enums;

/**
 * Compliance classification of one student's attendance in a window.
 */
public enum Verdict {

    /**
     * Attendance is at or above the threshold
     */
    COMPLIANT,

    /**
     * Attendance is measured and below the threshold
     */
    VIOLATION,

    /**
     * No classes recorded in the window; the student is unmeasured, not failing
     */
    NO_DATA
}
