package com.heronix.attendance.model.dto;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import com.heronix.attendance.exception.AttendanceValidationException;

/**
 * Inclusive calendar-date range used to scope aggregation and alert deduplication.
 *
 * @param start first day of the window (inclusive)
 * @param end   last day of the window (inclusive)
 */
public record AttendanceWindow(LocalDate start, LocalDate end) {

    private static final String KEY_SEPARATOR = "/";

    public AttendanceWindow {
        if (start == null || end == null) {
            throw new AttendanceValidationException("Window start and end are required");
        }
        if (end.isBefore(start)) {
            throw new AttendanceValidationException(
                    "Window end " + end + " is before start " + start);
        }
    }

    public static AttendanceWindow of(LocalDate start, LocalDate end) {
        return new AttendanceWindow(start, end);
    }

    /**
     * Window from ISO-8601 date literals, e.g. {@code of("2025-07-25", "2025-08-08")}.
     */
    public static AttendanceWindow of(String start, String end) {
        try {
            return new AttendanceWindow(LocalDate.parse(start), LocalDate.parse(end));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new AttendanceValidationException("Invalid window dates: " + start + " .. " + end, e);
        }
    }

    /**
     * Window of {@code days} calendar days ending on {@code endInclusive}.
     */
    public static AttendanceWindow trailing(LocalDate endInclusive, int days) {
        if (days < 1) {
            throw new AttendanceValidationException("Trailing window must cover at least one day");
        }
        return new AttendanceWindow(endInclusive.minusDays(days - 1L), endInclusive);
    }

    /**
     * Deterministic identifier of this window, used in the alert dedup key.
     */
    public String key() {
        return start + KEY_SEPARATOR + end;
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    @Override
    public String toString() {
        return key();
    }
}
