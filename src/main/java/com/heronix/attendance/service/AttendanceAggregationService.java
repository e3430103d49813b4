package com.heronix.attendance.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.model.dto.AttendanceWindow;
import com.heronix.attendance.model.dto.ComplianceSnapshot;
import com.heronix.attendance.model.dto.CourseAttendanceSummary;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.repository.AttendanceRecordRepository;

import lombok.RequiredArgsConstructor;

/**
 * Read-side counts over the attendance ledger.
 *
 * The two aggregates treat an empty range differently: a student snapshot with no
 * records has no percentage at all, while a course summary with no records reports
 * a rate of 0.
 */
@Service
@RequiredArgsConstructor
public class AttendanceAggregationService {

    private final AttendanceRecordRepository attendanceRepository;

    /**
     * Attendance snapshot for one student in one course.
     *
     * @param window inclusive date range, or null for all recorded dates
     */
    @Transactional(readOnly = true)
    public ComplianceSnapshot computeSnapshot(Long studentId, Long courseId, AttendanceWindow window) {
        long total;
        long present;

        if (window == null) {
            total = attendanceRepository.countByStudentIdAndCourseId(studentId, courseId);
            present = total == 0 ? 0
                    : attendanceRepository.countByStudentIdAndCourseIdAndStatus(
                            studentId, courseId, AttendanceStatus.PRESENT);
        } else {
            total = attendanceRepository.countByStudentIdAndCourseIdAndAttendanceDateBetween(
                    studentId, courseId, window.start(), window.end());
            present = total == 0 ? 0
                    : attendanceRepository.countByStudentIdAndCourseIdAndStatusAndAttendanceDateBetween(
                            studentId, courseId, AttendanceStatus.PRESENT, window.start(), window.end());
        }

        return new ComplianceSnapshot(studentId, courseId, window, total, present);
    }

    /**
     * Course-wide totals across all students.
     *
     * @param window inclusive date range, or null for all recorded dates
     */
    @Transactional(readOnly = true)
    public CourseAttendanceSummary computeCourseSummary(Long courseId, AttendanceWindow window) {
        long total;
        long present;

        if (window == null) {
            total = attendanceRepository.countByCourseId(courseId);
            present = attendanceRepository.countByCourseIdAndStatus(courseId, AttendanceStatus.PRESENT);
        } else {
            total = attendanceRepository.countByCourseIdAndAttendanceDateBetween(
                    courseId, window.start(), window.end());
            present = attendanceRepository.countByCourseIdAndStatusAndAttendanceDateBetween(
                    courseId, AttendanceStatus.PRESENT, window.start(), window.end());
        }

        return CourseAttendanceSummary.builder()
                .courseId(courseId)
                .window(window)
                .totalRecords(total)
                .presentRecords(present)
                .absentRecords(total - present)
                .rate(total > 0 ? present * 100.0 / total : 0.0)
                .build();
    }
}
