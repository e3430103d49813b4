package com.heronix.attendance.model.domain;

import java.time.LocalDateTime;

import com.heronix.attendance.model.enums.AlertStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Alert Record - idempotency and audit entry for a low-attendance alert.
 *
 * At most one row exists per (student, course, window key). A row is inserted as
 * {@link AlertStatus#PENDING} when a dispatcher claims the alert, promoted to
 * {@link AlertStatus#SENT} after the notifier succeeds, and deleted again if the
 * notifier fails so that a later run can retry.
 */
@Entity
@Table(name = "alert_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_alert_student_course_window",
                columnNames = {"student_id", "course_id", "window_key"})
    },
    indexes = {
        @Index(name = "idx_alert_course", columnList = "course_id"),
        @Index(name = "idx_alert_status", columnList = "status")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "course_id", nullable = false)
    private Long courseId;

    /**
     * Deterministic window identifier, e.g. "2025-07-25/2025-08-08".
     */
    @Column(name = "window_key", nullable = false, length = 32)
    private String windowKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    @Builder.Default
    private AlertStatus status = AlertStatus.PENDING;

    /**
     * Attendance percentage reported in the alert.
     */
    @Column(name = "percentage")
    private Double percentage;

    /**
     * Threshold in force when the alert was raised.
     */
    @Column(name = "threshold_percent")
    private Double thresholdPercent;

    @Column(name = "claimed_at", nullable = false)
    private LocalDateTime claimedAt;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Version
    private Long version;

    /**
     * A pending claim older than the given cutoff belongs to a dispatcher that never finished.
     */
    public boolean isStaleClaim(LocalDateTime cutoff) {
        return status == AlertStatus.PENDING && claimedAt != null && claimedAt.isBefore(cutoff);
    }

    public void markSent(LocalDateTime when) {
        this.status = AlertStatus.SENT;
        this.sentAt = when;
    }
}
