package com.heronix.attendance.exception;

/**
 * Exception thrown when attendance input is rejected before any write.
 */
public class AttendanceValidationException extends RuntimeException {

    public AttendanceValidationException(String message) {
        super(message);
    }

    public AttendanceValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
