package com.heronix.attendance.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.AttendanceRecord;
import com.heronix.attendance.model.enums.AttendanceStatus;

import jakarta.persistence.LockModeType;

/**
 * Repository for AttendanceRecord entities (the ledger store).
 */
@Repository
public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    Optional<AttendanceRecord> findByStudentIdAndCourseIdAndAttendanceDate(
            Long studentId, Long courseId, LocalDate attendanceDate);

    /**
     * Load the record for a composite key, holding a write lock until the transaction ends.
     * Serializes concurrent writers of the same (student, course, date).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AttendanceRecord a WHERE a.studentId = :studentId " +
           "AND a.courseId = :courseId AND a.attendanceDate = :date")
    Optional<AttendanceRecord> findForUpdate(
            @Param("studentId") Long studentId,
            @Param("courseId") Long courseId,
            @Param("date") LocalDate date);

    List<AttendanceRecord> findByStudentIdAndCourseIdAndAttendanceDateBetweenOrderByAttendanceDateAsc(
            Long studentId, Long courseId, LocalDate start, LocalDate end);

    List<AttendanceRecord> findByStudentIdAndCourseIdOrderByAttendanceDateAsc(Long studentId, Long courseId);

    List<AttendanceRecord> findByCourseIdAndAttendanceDateOrderByStudentIdAsc(Long courseId, LocalDate date);

    // ========================================================================
    // PER-STUDENT COUNTS
    // ========================================================================

    long countByStudentIdAndCourseIdAndAttendanceDateBetween(
            Long studentId, Long courseId, LocalDate start, LocalDate end);

    long countByStudentIdAndCourseIdAndStatusAndAttendanceDateBetween(
            Long studentId, Long courseId, AttendanceStatus status, LocalDate start, LocalDate end);

    long countByStudentIdAndCourseId(Long studentId, Long courseId);

    long countByStudentIdAndCourseIdAndStatus(Long studentId, Long courseId, AttendanceStatus status);

    // ========================================================================
    // COURSE-WIDE COUNTS
    // ========================================================================

    long countByCourseIdAndAttendanceDateBetween(Long courseId, LocalDate start, LocalDate end);

    long countByCourseIdAndStatusAndAttendanceDateBetween(
            Long courseId, AttendanceStatus status, LocalDate start, LocalDate end);

    long countByCourseId(Long courseId);

    long countByCourseIdAndStatus(Long courseId, AttendanceStatus status);
}
