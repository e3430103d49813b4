package com.heronix.attendance.exception;

/**
 * Exception thrown when a student is not known to the roster directory.
 */
public class StudentNotFoundException extends RuntimeException {

    public StudentNotFoundException(Long studentId) {
        super("Student not found: " + studentId);
    }

    public StudentNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
