package com.heronix.attendance.directory;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.attendance.model.domain.AppUser;
import com.heronix.attendance.model.domain.Course;
import com.heronix.attendance.model.dto.CourseInfo;
import com.heronix.attendance.model.dto.StudentContact;
import com.heronix.attendance.model.enums.UserRole;
import com.heronix.attendance.repository.AppUserRepository;
import com.heronix.attendance.repository.CourseRepository;

import lombok.RequiredArgsConstructor;

/**
 * Directory backed by the shared {@code users} and {@code courses} tables.
 *
 * Every active student is on the roster of every course, matching the course model
 * of the surrounding application.
 */
@Component
@RequiredArgsConstructor
public class JpaRosterDirectory implements RosterDirectory {

    private final CourseRepository courseRepository;
    private final AppUserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<CourseInfo> findCourse(Long courseId) {
        if (courseId == null) {
            return Optional.empty();
        }
        return courseRepository.findById(courseId).map(JpaRosterDirectory::toCourseInfo);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StudentContact> findStudent(Long studentId) {
        if (studentId == null) {
            return Optional.empty();
        }
        return userRepository.findById(studentId)
                .filter(AppUser::isStudent)
                .map(JpaRosterDirectory::toContact);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StudentContact> activeStudents(Long courseId) {
        return userRepository.findByRoleAndActiveTrueOrderByFullNameAsc(UserRole.STUDENT).stream()
                .map(JpaRosterDirectory::toContact)
                .toList();
    }

    private static CourseInfo toCourseInfo(Course course) {
        return new CourseInfo(course.getId(), course.getName(), course.getFacultyId(),
                course.isActive(), course.getAttendanceThreshold());
    }

    private static StudentContact toContact(AppUser user) {
        return new StudentContact(user.getId(), user.getEmail(), user.getFullName());
    }
}
