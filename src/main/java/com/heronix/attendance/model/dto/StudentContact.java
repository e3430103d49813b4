package com.heronix.attendance.model.dto;

/**
 * Contact details of a student as supplied by the user directory.
 */
public record StudentContact(Long studentId, String email, String fullName) {
}
