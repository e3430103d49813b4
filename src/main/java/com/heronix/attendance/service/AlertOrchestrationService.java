package com.heronix.attendance.service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.directory.RosterDirectory;
import com.heronix.attendance.exception.CourseNotFoundException;
import com.heronix.attendance.model.dto.AttendanceWindow;
import com.heronix.attendance.model.dto.ComplianceSnapshot;
import com.heronix.attendance.model.dto.CourseInfo;
import com.heronix.attendance.model.dto.StudentContact;
import com.heronix.attendance.model.enums.DispatchOutcome;
import com.heronix.attendance.model.enums.Verdict;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs one compliance pass over a course: every active student is measured in the
 * reporting window, and each violation is handed to the {@link AlertDispatchService}.
 *
 * A pass holds no state of its own; the ledger and the alert records are the only
 * shared resources. One student's failed dispatch never stops the others, and alerts
 * already sent stay committed when a pass is cancelled.
 */
@Service
@Slf4j
public class AlertOrchestrationService {

    private final RosterDirectory rosterDirectory;
    private final AttendanceAggregationService aggregationService;
    private final ThresholdEvaluator thresholdEvaluator;
    private final AlertDispatchService dispatchService;
    private final ReportingWindowResolver windowResolver;
    private final AttendanceProperties properties;
    private final Executor evaluationExecutor;

    public AlertOrchestrationService(
            RosterDirectory rosterDirectory,
            AttendanceAggregationService aggregationService,
            ThresholdEvaluator thresholdEvaluator,
            AlertDispatchService dispatchService,
            ReportingWindowResolver windowResolver,
            AttendanceProperties properties,
            @Qualifier("alertEvaluationExecutor") Executor evaluationExecutor) {

        this.rosterDirectory = rosterDirectory;
        this.aggregationService = aggregationService;
        this.thresholdEvaluator = thresholdEvaluator;
        this.dispatchService = dispatchService;
        this.windowResolver = windowResolver;
        this.properties = properties;
        this.evaluationExecutor = evaluationExecutor;
    }

    /**
     * Summary of one alerting pass.
     */
    public record AlertRunSummary(
            String runId,
            Long courseId,
            AttendanceWindow window,
            double thresholdPercent,
            int evaluated,
            int compliant,
            int noData,
            int violations,
            int alerted,
            int skippedDuplicate,
            int failed,
            boolean cancelled,
            LocalDateTime startedAt,
            LocalDateTime completedAt
    ) {}

    /**
     * Outcome for one student within a pass.
     */
    record StudentResult(Long studentId, Verdict verdict, DispatchOutcome outcome) {}

    /**
     * Run a pass with the configured reporting window.
     */
    public AlertRunSummary runForCourse(Long courseId) {
        return runForCourse(courseId, windowResolver.currentWindow());
    }

    /**
     * Run a pass over an explicit window.
     *
     * @throws CourseNotFoundException if the course is unknown or inactive
     */
    public AlertRunSummary runForCourse(Long courseId, AttendanceWindow window) {
        String runId = UUID.randomUUID().toString();
        LocalDateTime startedAt = LocalDateTime.now();

        CourseInfo course = rosterDirectory.findCourse(courseId)
                .filter(CourseInfo::active)
                .orElseThrow(() -> new CourseNotFoundException(courseId));

        AttendanceWindow effectiveWindow = window != null ? window : windowResolver.currentWindow();
        double threshold = course.thresholdOverride() != null
                ? course.thresholdOverride()
                : properties.getAlerts().getThresholdPercent();

        List<StudentContact> students = rosterDirectory.activeStudents(courseId);
        log.info("Starting alert run {} for course {} over {} students (window {}, threshold {}%)",
                runId, courseId, students.size(), effectiveWindow, threshold);

        List<StudentResult> results = new ArrayList<>(students.size());
        boolean cancelled;
        if (properties.getAlerts().getParallelThreads() > 1 && students.size() > 1) {
            cancelled = evaluateInParallel(students, course, effectiveWindow, threshold, results);
        } else {
            cancelled = evaluateSequentially(students, course, effectiveWindow, threshold, results);
        }

        AlertRunSummary summary = summarize(runId, courseId, effectiveWindow, threshold, results,
                cancelled, startedAt);

        log.info("Alert run {} for course {} finished: evaluated={}, violations={}, alerted={}, "
                        + "skippedDuplicate={}, failed={}, cancelled={}",
                runId, courseId, summary.evaluated(), summary.violations(), summary.alerted(),
                summary.skippedDuplicate(), summary.failed(), summary.cancelled());
        return summary;
    }

    // ========================================================================
    // PER-STUDENT EVALUATION
    // ========================================================================

    /**
     * Measure, classify and (for violations) dispatch one student.
     * Store failures propagate, whether measuring or dispatching; notifier failures
     * inside a dispatch are contained.
     */
    StudentResult evaluateStudent(StudentContact student, CourseInfo course, AttendanceWindow window,
                                  double threshold) {
        ComplianceSnapshot snapshot = aggregationService.computeSnapshot(
                student.studentId(), course.courseId(), window);
        Verdict verdict = thresholdEvaluator.evaluate(snapshot, threshold);

        log.debug("Student {} course {}: {}/{} present -> {}", student.studentId(), course.courseId(),
                snapshot.presentClasses(), snapshot.totalClasses(), verdict);

        if (verdict != Verdict.VIOLATION) {
            return new StudentResult(student.studentId(), verdict, null);
        }

        DispatchOutcome outcome;
        try {
            outcome = dispatchService.dispatch(student, course, window, snapshot, threshold);
        } catch (DataAccessException | TransactionException e) {
            // the alert store is unavailable: fatal to the pass
            throw e;
        } catch (RuntimeException e) {
            log.error("Alert dispatch for student {} course {} failed: {}",
                    student.studentId(), course.courseId(), e.getMessage());
            outcome = DispatchOutcome.FAILED;
        }
        return new StudentResult(student.studentId(), verdict, outcome);
    }

    private boolean evaluateSequentially(List<StudentContact> students, CourseInfo course,
                                         AttendanceWindow window, double threshold,
                                         List<StudentResult> results) {
        for (StudentContact student : students) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Alert run for course {} cancelled after {} of {} students",
                        course.courseId(), results.size(), students.size());
                return true;
            }
            results.add(evaluateStudent(student, course, window, threshold));
        }
        return false;
    }

    private boolean evaluateInParallel(List<StudentContact> students, CourseInfo course,
                                       AttendanceWindow window, double threshold,
                                       List<StudentResult> results) {
        List<CompletableFuture<StudentResult>> futures = new ArrayList<>(students.size());
        for (StudentContact student : students) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> evaluateStudent(student, course, window, threshold), evaluationExecutor));
        }

        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(future -> future.cancel(true));
                log.warn("Alert run for course {} cancelled after {} of {} students",
                        course.courseId(), results.size(), students.size());
                return true;
            } catch (ExecutionException e) {
                futures.subList(i + 1, futures.size()).forEach(future -> future.cancel(true));
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Student evaluation failed", e.getCause());
            }
        }
        return false;
    }

    private static AlertRunSummary summarize(String runId, Long courseId, AttendanceWindow window,
                                             double threshold, List<StudentResult> results,
                                             boolean cancelled, LocalDateTime startedAt) {
        int compliant = 0;
        int noData = 0;
        int violations = 0;
        int alerted = 0;
        int skipped = 0;
        int failed = 0;

        for (StudentResult result : results) {
            switch (result.verdict()) {
                case COMPLIANT -> compliant++;
                case NO_DATA -> noData++;
                case VIOLATION -> {
                    violations++;
                    switch (result.outcome()) {
                        case SENT -> alerted++;
                        case SKIPPED_DUPLICATE -> skipped++;
                        case FAILED -> failed++;
                    }
                }
            }
        }

        return new AlertRunSummary(runId, courseId, window, threshold, results.size(),
                compliant, noData, violations, alerted, skipped, failed, cancelled,
                startedAt, LocalDateTime.now());
    }
}
