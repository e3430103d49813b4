package com.heronix.attendance.model.dto;

/**
 * Course metadata as supplied by the course directory.
 *
 * @param thresholdOverride course-specific threshold in percent, or null for the global default
 */
public record CourseInfo(Long courseId, String name, Long facultyId, boolean active, Double thresholdOverride) {
}
