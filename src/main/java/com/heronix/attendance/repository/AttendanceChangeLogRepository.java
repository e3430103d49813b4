package com.heronix.attendance.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.heronix.attendance.model.domain.AttendanceChangeLog;

@Repository
public interface AttendanceChangeLogRepository extends JpaRepository<AttendanceChangeLog, Long> {

    List<AttendanceChangeLog> findByAttendanceRecordIdOrderByCreatedAtAsc(Long attendanceRecordId);
}
