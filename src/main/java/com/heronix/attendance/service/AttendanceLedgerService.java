package com.heronix.attendance.service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.directory.RosterDirectory;
import com.heronix.attendance.exception.AttendanceValidationException;
import com.heronix.attendance.exception.CourseNotFoundException;
import com.heronix.attendance.exception.StudentNotFoundException;
import com.heronix.attendance.model.domain.AttendanceChangeLog;
import com.heronix.attendance.model.domain.AttendanceRecord;
import com.heronix.attendance.model.dto.AttendanceActor;
import com.heronix.attendance.model.dto.AttendanceWindow;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.repository.AttendanceChangeLogRepository;
import com.heronix.attendance.repository.AttendanceRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The attendance ledger: durable store of one status per (student, course, date).
 *
 * Writes are upserts on the composite key. A write for an existing key replaces the
 * status and appends an {@link AttendanceChangeLog} entry when the status changes.
 * The ledger does not authorize callers; the {@link AttendanceActor} is kept for audit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceLedgerService {

    private final AttendanceRecordRepository attendanceRepository;
    private final AttendanceChangeLogRepository changeLogRepository;
    private final RosterDirectory rosterDirectory;

    // ========================================================================
    // WRITES
    // ========================================================================

    /**
     * Record one student's status for a course and date.
     *
     * @return the inserted or updated record
     * @throws AttendanceValidationException if date or status is missing
     * @throws CourseNotFoundException       if the course is unknown or inactive
     * @throws StudentNotFoundException      if the student is unknown
     */
    @Transactional
    public AttendanceRecord recordAttendance(Long studentId, Long courseId, LocalDate date,
                                             AttendanceStatus status, AttendanceActor actor) {
        requireActor(actor);
        requireDate(date);
        if (status == null) {
            throw new AttendanceValidationException("Attendance status is required");
        }
        requireActiveCourse(courseId);
        requireStudent(studentId);

        return upsert(studentId, courseId, date, status, actor);
    }

    /**
     * Variant taking raw input, e.g. {@code ("2025-01-10", "Present")}.
     *
     * @throws AttendanceValidationException if the date is not a valid ISO calendar date
     *                                       or the status is not Present/Absent
     */
    @Transactional
    public AttendanceRecord recordAttendance(Long studentId, Long courseId, String date,
                                             String status, AttendanceActor actor) {
        return recordAttendance(studentId, courseId, parseDate(date), AttendanceStatus.fromValue(status), actor);
    }

    /**
     * Record a whole class sheet for one date.
     *
     * Each key of {@code presence} receives exactly one status: PRESENT when mapped to
     * true, ABSENT otherwise. Students not in the map are left untouched. All entries are
     * validated before the first write and the batch commits or rolls back as a unit.
     *
     * @param presence studentId -> present, see {@link com.heronix.attendance.model.dto.AttendanceBatch}
     * @return the written records in map iteration order
     */
    @Transactional
    public List<AttendanceRecord> recordAttendanceBatch(Long courseId, LocalDate date,
                                                        Map<Long, Boolean> presence, AttendanceActor actor) {
        requireActor(actor);
        requireDate(date);
        if (presence == null) {
            throw new AttendanceValidationException("Presence map is required");
        }
        requireActiveCourse(courseId);

        for (Map.Entry<Long, Boolean> entry : presence.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new AttendanceValidationException("Batch entry has no student id or no presence flag");
            }
            requireStudent(entry.getKey());
        }

        List<AttendanceRecord> written = new ArrayList<>(presence.size());
        for (Map.Entry<Long, Boolean> entry : presence.entrySet()) {
            written.add(upsert(entry.getKey(), courseId, date,
                    AttendanceStatus.fromPresence(entry.getValue()), actor));
        }

        long presentCount = presence.values().stream().filter(Boolean::booleanValue).count();
        log.info("Recorded attendance for course {} on {}: {} students, {} present",
                courseId, date, written.size(), presentCount);
        return written;
    }

    // ========================================================================
    // READS
    // ========================================================================

    /**
     * Records of one student in one course within the window, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AttendanceRecord> getRecordsForWindow(Long studentId, Long courseId, AttendanceWindow window) {
        if (window == null) {
            return attendanceRepository.findByStudentIdAndCourseIdOrderByAttendanceDateAsc(studentId, courseId);
        }
        return attendanceRepository.findByStudentIdAndCourseIdAndAttendanceDateBetweenOrderByAttendanceDateAsc(
                studentId, courseId, window.start(), window.end());
    }

    /**
     * All records of a course for one day, for reviewing or correcting a class sheet.
     */
    @Transactional(readOnly = true)
    public List<AttendanceRecord> getRecordsForCourseOnDate(Long courseId, LocalDate date) {
        requireDate(date);
        return attendanceRepository.findByCourseIdAndAttendanceDateOrderByStudentIdAsc(courseId, date);
    }

    @Transactional(readOnly = true)
    public Optional<AttendanceRecord> findRecord(Long studentId, Long courseId, LocalDate date) {
        return attendanceRepository.findByStudentIdAndCourseIdAndAttendanceDate(studentId, courseId, date);
    }

    @Transactional(readOnly = true)
    public List<AttendanceChangeLog> getChangeHistory(Long attendanceRecordId) {
        return changeLogRepository.findByAttendanceRecordIdOrderByCreatedAtAsc(attendanceRecordId);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private AttendanceRecord upsert(Long studentId, Long courseId, LocalDate date,
                                    AttendanceStatus status, AttendanceActor actor) {
        Optional<AttendanceRecord> existing = attendanceRepository.findForUpdate(studentId, courseId, date);

        if (existing.isEmpty()) {
            AttendanceRecord created = AttendanceRecord.builder()
                    .studentId(studentId)
                    .courseId(courseId)
                    .attendanceDate(date)
                    .status(status)
                    .markedByUserId(actor.userId())
                    .build();
            // flush now so a racing insert of the same key fails inside this call
            AttendanceRecord saved = attendanceRepository.saveAndFlush(created);
            log.debug("Created attendance {} for student {} course {} on {}", status, studentId, courseId, date);
            return saved;
        }

        AttendanceRecord record = existing.get();
        AttendanceStatus previous = record.getStatus();
        record.setMarkedByUserId(actor.userId());

        if (previous != status) {
            record.setStatus(status);
            changeLogRepository.save(AttendanceChangeLog.builder()
                    .attendanceRecordId(record.getId())
                    .changedBy(actor.userId())
                    .oldStatus(previous)
                    .newStatus(status)
                    .reason("Re-marked by " + actor.role())
                    .build());
            log.debug("Changed attendance for student {} course {} on {}: {} -> {}",
                    studentId, courseId, date, previous, status);
        }

        return attendanceRepository.save(record);
    }

    private void requireActiveCourse(Long courseId) {
        boolean active = rosterDirectory.findCourse(courseId)
                .map(course -> course.active())
                .orElse(false);
        if (!active) {
            throw new CourseNotFoundException(courseId);
        }
    }

    private void requireStudent(Long studentId) {
        if (rosterDirectory.findStudent(studentId).isEmpty()) {
            throw new StudentNotFoundException(studentId);
        }
    }

    private static void requireActor(AttendanceActor actor) {
        if (actor == null) {
            throw new AttendanceValidationException("Caller identity is required for attendance writes");
        }
    }

    private static void requireDate(LocalDate date) {
        if (date == null) {
            throw new AttendanceValidationException("Attendance date is required");
        }
    }

    private static LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            throw new AttendanceValidationException("Attendance date is required");
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new AttendanceValidationException("Invalid attendance date: " + date, e);
        }
    }
}
