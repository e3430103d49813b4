package com.heronix.attendance.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.AlertRecord;
import com.heronix.attendance.model.enums.AlertStatus;

/**
 * Repository for AlertRecord entities. The unique constraint on
 * (student_id, course_id, window_key) is what makes a dispatch claim atomic.
 */
@Repository
public interface AlertRecordRepository extends JpaRepository<AlertRecord, Long> {

    Optional<AlertRecord> findByStudentIdAndCourseIdAndWindowKey(Long studentId, Long courseId, String windowKey);

    boolean existsByStudentIdAndCourseIdAndWindowKeyAndStatus(
            Long studentId, Long courseId, String windowKey, AlertStatus status);

    List<AlertRecord> findByCourseIdAndWindowKeyOrderByStudentIdAsc(Long courseId, String windowKey);
}
