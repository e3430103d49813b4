package com.heronix.attendance.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.model.domain.AlertRecord;
import com.heronix.attendance.model.dto.AttendanceWindow;
import com.heronix.attendance.model.dto.ComplianceSnapshot;
import com.heronix.attendance.model.dto.CourseInfo;
import com.heronix.attendance.model.dto.StudentContact;
import com.heronix.attendance.model.enums.AlertStatus;
import com.heronix.attendance.model.enums.DispatchOutcome;
import com.heronix.attendance.model.enums.NotificationType;
import com.heronix.attendance.notifier.AttendanceNotifier;
import com.heronix.attendance.notifier.AttendanceNotifier.AlertMessage;
import com.heronix.attendance.notifier.AttendanceNotifier.DeliveryResult;
import com.heronix.attendance.repository.AlertRecordRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a violation into at most one delivered alert per (student, course, window).
 *
 * Dispatch runs in three committed steps:
 * <ol>
 *   <li>claim: insert a PENDING {@link AlertRecord}; the unique key makes this atomic
 *       across concurrent runs, and an existing SENT or fresh PENDING record means
 *       the alert is a duplicate</li>
 *   <li>notify: call the {@link AttendanceNotifier} outside any transaction</li>
 *   <li>settle: mark the record SENT, or delete the claim when delivery failed so a
 *       later run retries; the in-app notification for a sent alert is created after
 *       the SENT mark has committed</li>
 * </ol>
 */
@Service
@Slf4j
public class AlertDispatchService {

    private static final String ALERT_TITLE = "Low Attendance Alert";

    private final AlertRecordRepository alertRepository;
    private final AttendanceNotifier notifier;
    private final NotificationService notificationService;
    private final AttendanceProperties properties;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public AlertDispatchService(
            AlertRecordRepository alertRepository,
            AttendanceNotifier notifier,
            NotificationService notificationService,
            AttendanceProperties properties,
            Clock clock,
            PlatformTransactionManager transactionManager) {

        this.alertRepository = alertRepository;
        this.notifier = notifier;
        this.notificationService = notificationService;
        this.properties = properties;
        this.clock = clock;

        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Deliver a low-attendance alert unless one was already sent for this window.
     *
     * @param student          recipient
     * @param course           course the violation belongs to
     * @param window           reporting window; its key is part of the dedup key
     * @param snapshot         measured attendance, must have data
     * @param thresholdPercent threshold the student fell below
     * @return SENT, SKIPPED_DUPLICATE or FAILED
     */
    public DispatchOutcome dispatch(StudentContact student, CourseInfo course, AttendanceWindow window,
                                    ComplianceSnapshot snapshot, double thresholdPercent) {
        if (!snapshot.hasData()) {
            throw new IllegalArgumentException("Cannot dispatch an alert for a snapshot without data");
        }

        double percentage = snapshot.percentage().getAsDouble();
        String windowKey = window.key();

        Optional<Long> claimId = claim(student.studentId(), course.courseId(), windowKey,
                percentage, thresholdPercent);
        if (claimId.isEmpty()) {
            log.debug("Alert for student {} course {} window {} already sent or in flight",
                    student.studentId(), course.courseId(), windowKey);
            return DispatchOutcome.SKIPPED_DUPLICATE;
        }

        AlertMessage message = new AlertMessage(student.email(), student.fullName(), course.name(),
                percentage, thresholdPercent);

        DeliveryResult result;
        try {
            result = notifier.send(message);
        } catch (RuntimeException e) {
            result = DeliveryResult.failure(e.getMessage());
        }

        if (!result.success()) {
            releaseClaim(claimId.get());
            log.warn("Alert delivery failed for student {} course {} window {}: {}",
                    student.studentId(), course.courseId(), windowKey, result.message());
            return DispatchOutcome.FAILED;
        }

        markSent(claimId.get());
        notifyInApp(student, course, percentage, thresholdPercent);
        log.info("Alert sent to student {} for course {} ({}% < {}%, window {})",
                student.studentId(), course.courseId(), format(percentage), format(thresholdPercent), windowKey);
        return DispatchOutcome.SENT;
    }

    /**
     * Whether an alert was already delivered for the student, course and window.
     */
    public boolean hasAlerted(Long studentId, Long courseId, AttendanceWindow window) {
        return alertRepository.existsByStudentIdAndCourseIdAndWindowKeyAndStatus(
                studentId, courseId, window.key(), AlertStatus.SENT);
    }

    public List<AlertRecord> getAlertsForWindow(Long courseId, AttendanceWindow window) {
        return alertRepository.findByCourseIdAndWindowKeyOrderByStudentIdAsc(courseId, window.key());
    }

    // ========================================================================
    // CLAIM LIFECYCLE
    // ========================================================================

    /**
     * Atomically insert-if-absent a PENDING record, or take over an abandoned claim.
     *
     * @return id of the claimed record, empty if another run owns or completed the alert
     */
    private Optional<Long> claim(Long studentId, Long courseId, String windowKey,
                                 double percentage, double thresholdPercent) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime staleCutoff = now.minus(properties.getDispatch().getClaimTimeout());

        try {
            return requiresNew.execute(status -> {
                Optional<AlertRecord> existing =
                        alertRepository.findByStudentIdAndCourseIdAndWindowKey(studentId, courseId, windowKey);

                if (existing.isPresent()) {
                    AlertRecord record = existing.get();
                    if (!record.isStaleClaim(staleCutoff)) {
                        return Optional.<Long>empty();
                    }
                    log.warn("Re-claiming abandoned alert claim {} (claimed at {})",
                            record.getId(), record.getClaimedAt());
                    record.setClaimedAt(now);
                    record.setPercentage(percentage);
                    record.setThresholdPercent(thresholdPercent);
                    return Optional.of(alertRepository.saveAndFlush(record).getId());
                }

                AlertRecord claimed = alertRepository.saveAndFlush(AlertRecord.builder()
                        .studentId(studentId)
                        .courseId(courseId)
                        .windowKey(windowKey)
                        .status(AlertStatus.PENDING)
                        .percentage(percentage)
                        .thresholdPercent(thresholdPercent)
                        .claimedAt(now)
                        .build());
                return Optional.of(claimed.getId());
            });
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
            // a concurrent run inserted or re-claimed the same key first
            return Optional.empty();
        }
    }

    private void releaseClaim(Long claimId) {
        requiresNew.executeWithoutResult(status -> alertRepository.deleteById(claimId));
    }

    /**
     * Commit the SENT mark on its own. A store failure after delivery propagates and is
     * never reported as FAILED.
     */
    private void markSent(Long claimId) {
        try {
            requiresNew.executeWithoutResult(status -> {
                AlertRecord record = alertRepository.findById(claimId)
                        .orElseThrow(() -> new IllegalStateException("Alert claim vanished: " + claimId));
                record.markSent(LocalDateTime.now(clock));
                alertRepository.save(record);
            });
        } catch (RuntimeException e) {
            log.error("Alert {} was delivered but could not be marked SENT: {}", claimId, e.getMessage());
            throw e;
        }
    }

    /**
     * In-app copy of a delivered alert. Failure here does not affect the dispatch outcome.
     */
    private void notifyInApp(StudentContact student, CourseInfo course, double percentage, double thresholdPercent) {
        try {
            notificationService.createNotification(student.studentId(), ALERT_TITLE,
                    "Your attendance for " + course.name() + " is " + format(percentage)
                            + "% (below " + format(thresholdPercent) + "%)",
                    NotificationType.ATTENDANCE_ALERT);
        } catch (RuntimeException e) {
            log.warn("Alert sent to student {} but in-app notification failed: {}",
                    student.studentId(), e.getMessage());
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
