package com.heronix.attendance.directory;

import java.util.List;
import java.util.Optional;

import com.heronix.attendance.model.dto.CourseInfo;
import com.heronix.attendance.model.dto.StudentContact;

/**
 * Read-only view of the user and course directory consumed by the attendance core.
 *
 * Implementations own enrollment rules; the core never decides who belongs to a course.
 */
public interface RosterDirectory {

    /**
     * Look up course metadata, whether or not the course is active.
     */
    Optional<CourseInfo> findCourse(Long courseId);

    /**
     * Look up an active or inactive student by id. Non-student users are not returned.
     */
    Optional<StudentContact> findStudent(Long studentId);

    /**
     * Active students on the roster of a course, in a stable order.
     */
    List<StudentContact> activeStudents(Long courseId);
}
