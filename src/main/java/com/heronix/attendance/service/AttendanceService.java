package com.heronix.attendance.service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.model.domain.AttendanceRecord;
import com.heronix.attendance.model.dto.AttendanceActor;
import com.heronix.attendance.model.dto.AttendanceBatch;
import com.heronix.attendance.model.enums.AttendanceStatus;
import com.heronix.attendance.service.AlertOrchestrationService.AlertRunSummary;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for attendance writes coming from the surrounding application.
 *
 * Every successful write is followed by a synchronous compliance pass over the
 * affected course using the configured reporting window, so alerts reflect the
 * attendance just recorded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceService {

    private final AttendanceLedgerService ledgerService;
    private final AlertOrchestrationService orchestrationService;
    private final AttendanceProperties properties;

    /**
     * Result of a write plus the alert pass it triggered.
     *
     * @param alertRun null when write-triggered evaluation is disabled
     */
    public record AttendanceWriteResult(
            List<AttendanceRecord> records,
            AlertRunSummary alertRun
    ) {}

    public AttendanceWriteResult recordAttendance(Long studentId, Long courseId, LocalDate date,
                                                  AttendanceStatus status, AttendanceActor actor) {
        AttendanceRecord record = withInsertRetry(
                () -> ledgerService.recordAttendance(studentId, courseId, date, status, actor));
        return new AttendanceWriteResult(List.of(record), evaluate(courseId));
    }

    public AttendanceWriteResult recordAttendance(Long studentId, Long courseId, String date,
                                                  String status, AttendanceActor actor) {
        AttendanceRecord record = withInsertRetry(
                () -> ledgerService.recordAttendance(studentId, courseId, date, status, actor));
        return new AttendanceWriteResult(List.of(record), evaluate(courseId));
    }

    /**
     * Record a class sheet given as studentId -> present.
     */
    public AttendanceWriteResult recordAttendanceBatch(Long courseId, LocalDate date,
                                                       Map<Long, Boolean> presence, AttendanceActor actor) {
        List<AttendanceRecord> records = withInsertRetry(
                () -> ledgerService.recordAttendanceBatch(courseId, date, presence, actor));
        return new AttendanceWriteResult(records, evaluate(courseId));
    }

    /**
     * Record a class sheet given as the displayed roster plus the ids ticked present.
     */
    public AttendanceWriteResult recordAttendanceBatch(Long courseId, LocalDate date, List<Long> rosterIds,
                                                       Collection<Long> presentIds, AttendanceActor actor) {
        return recordAttendanceBatch(courseId, date, AttendanceBatch.fromRoster(rosterIds, presentIds), actor);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private AlertRunSummary evaluate(Long courseId) {
        if (!properties.getAlerts().isEvaluateOnWrite()) {
            return null;
        }
        return orchestrationService.runForCourse(courseId);
    }

    /**
     * Two writers inserting the same new key race on the unique constraint. The loser
     * retries once in a fresh transaction, where it finds the winner's row and updates it.
     */
    private static <T> T withInsertRetry(Supplier<T> write) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent attendance insert detected, retrying write: {}", e.getMostSpecificCause().getMessage());
            return write.get();
        }
    }
}
