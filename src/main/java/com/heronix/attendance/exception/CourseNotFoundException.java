package com.heronix.attendance.exception;

/**
 * Exception thrown when a course is unknown or no longer active.
 */
public class CourseNotFoundException extends RuntimeException {

    public CourseNotFoundException(Long courseId) {
        super("Course not found or inactive: " + courseId);
    }

    public CourseNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
