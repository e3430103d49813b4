package com.heronix.attendance.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Course-wide attendance totals across all students.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseAttendanceSummary {

    private Long courseId;

    /**
     * Null when the summary covers all recorded dates.
     */
    private AttendanceWindow window;

    private long totalRecords;

    private long presentRecords;

    private long absentRecords;

    /**
     * Present share in percent; 0 when there are no records.
     */
    private double rate;
}
