package com.heronix.attendance.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Course as maintained by the course directory.
 *
 * Only the active flag, the faculty owner and the threshold override change
 * after creation, and those changes are made by administrators outside this module.
 */
@Entity
@Table(name = "courses", indexes = {
    @Index(name = "idx_course_faculty", columnList = "faculty_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "code", unique = true, length = 20)
    private String code;

    /**
     * Owning faculty user, nullable until assigned.
     */
    @Column(name = "faculty_id")
    private Long facultyId;

    /**
     * Course-specific compliance threshold in percent. Null means the global default applies.
     */
    @Column(name = "attendance_threshold")
    private Double attendanceThreshold;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }
}
