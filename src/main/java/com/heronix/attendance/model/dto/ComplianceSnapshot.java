package com.heronix.attendance.model.dto;

import java.util.OptionalDouble;

/**
 * Derived attendance figures for one student in one course over a window.
 *
 * The percentage is undefined when no classes were recorded; callers must branch on
 * {@link #hasData()} (or the empty {@link #percentage()}) instead of treating it as 0%.
 *
 * @param window null when the snapshot covers all recorded dates
 */
public record ComplianceSnapshot(
        Long studentId,
        Long courseId,
        AttendanceWindow window,
        long totalClasses,
        long presentClasses
) {

    public ComplianceSnapshot {
        if (totalClasses < 0 || presentClasses < 0 || presentClasses > totalClasses) {
            throw new IllegalArgumentException(
                    "Inconsistent counts: present=" + presentClasses + ", total=" + totalClasses);
        }
    }

    public boolean hasData() {
        return totalClasses > 0;
    }

    public OptionalDouble percentage() {
        if (!hasData()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(presentClasses * 100.0 / totalClasses);
    }

    public long absentClasses() {
        return totalClasses - presentClasses;
    }
}
