package com.heronix.attendance.model.enums;

import com.heronix.attendance.exception.AttendanceValidationException;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a single attendance fact.
 */
@Getter
@RequiredArgsConstructor
public enum AttendanceStatus {

    /**
     * Student attended the class
     */
    PRESENT("Present"),

    /**
     * Student missed the class
     */
    ABSENT("Absent");

    /**
     * Human-facing label ("Present" / "Absent")
     */
    private final String label;

    /**
     * Parse a status from its label or constant name, ignoring case.
     *
     * @param value the raw status (e.g., "Present", "ABSENT")
     * @return matching AttendanceStatus
     * @throws AttendanceValidationException if value is blank or not an allowed status
     */
    public static AttendanceStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new AttendanceValidationException("Attendance status is required");
        }
        String trimmed = value.trim();
        for (AttendanceStatus status : values()) {
            if (status.label.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        throw new AttendanceValidationException("Unknown attendance status: " + value);
    }

    public static AttendanceStatus fromPresence(boolean present) {
        return present ? PRESENT : ABSENT;
    }
}
