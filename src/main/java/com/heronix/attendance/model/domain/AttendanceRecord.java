package com.heronix.attendance.model.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.heronix.attendance.model.enums.AttendanceStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One attendance fact per (student, course, calendar date).
 *
 * The composite key is enforced by a unique constraint; a second write for the
 * same key updates {@link #status} in place instead of inserting a new row.
 */
@Entity
@Table(name = "attendance_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_attendance_student_course_date",
                columnNames = {"student_id", "course_id", "attendance_date"})
    },
    indexes = {
        @Index(name = "idx_attendance_course_date", columnList = "course_id, attendance_date")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @NotNull
    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @NotNull
    @Column(name = "attendance_date", nullable = false)
    private LocalDate attendanceDate;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private AttendanceStatus status;

    /**
     * User who last marked this record (audit only, no authorization meaning).
     */
    @Column(name = "marked_by_user_id")
    private Long markedByUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
