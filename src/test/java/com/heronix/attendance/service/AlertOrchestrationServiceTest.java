package com.heronix.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import com.heronix.attendance.config.AttendanceProperties;
import com.heronix.attendance.directory.RosterDirectory;
import com.heronix.attendance.exception.CourseNotFoundException;
import com.heronix.attendance.model.dto.AttendanceWindow;
import com.heronix.attendance.model.dto.ComplianceSnapshot;
import com.heronix.attendance.model.dto.CourseInfo;
import com.heronix.attendance.model.dto.StudentContact;
import com.heronix.attendance.model.enums.DispatchOutcome;
import com.heronix.attendance.service.AlertOrchestrationService.AlertRunSummary;

@ExtendWith(MockitoExtension.class)
class AlertOrchestrationServiceTest {

    private static final Long COURSE_ID = 7L;
    private static final AttendanceWindow WINDOW = AttendanceWindow.of("2025-07-25", "2025-08-08");

    private static final StudentContact ASHA = new StudentContact(1L, "asha@example.edu", "Asha Rao");
    private static final StudentContact BILAL = new StudentContact(2L, "bilal@example.edu", "Bilal Khan");
    private static final StudentContact CHEN = new StudentContact(3L, "chen@example.edu", "Chen Li");

    @Mock
    private RosterDirectory rosterDirectory;

    @Mock
    private AttendanceAggregationService aggregationService;

    @Mock
    private AlertDispatchService dispatchService;

    @Mock
    private ReportingWindowResolver windowResolver;

    private AttendanceProperties properties;
    private AlertOrchestrationService orchestrationService;

    @BeforeEach
    void setUp() {
        properties = new AttendanceProperties();
        orchestrationService = new AlertOrchestrationService(rosterDirectory, aggregationService,
                new ThresholdEvaluator(), dispatchService, windowResolver, properties, Runnable::run);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void onlyViolationsAreDispatched() {
        CourseInfo course = activeCourse(null);
        givenRoster(course, ASHA, BILAL, CHEN);
        givenSnapshot(ASHA, 10, 9);
        givenSnapshot(BILAL, 10, 5);
        givenSnapshot(CHEN, 0, 0);
        when(dispatchService.dispatch(eq(BILAL), eq(course), eq(WINDOW), any(), eq(75.0)))
                .thenReturn(DispatchOutcome.SENT);

        AlertRunSummary summary = orchestrationService.runForCourse(COURSE_ID, WINDOW);

        assertThat(summary.evaluated()).isEqualTo(3);
        assertThat(summary.compliant()).isEqualTo(1);
        assertThat(summary.noData()).isEqualTo(1);
        assertThat(summary.violations()).isEqualTo(1);
        assertThat(summary.alerted()).isEqualTo(1);
        assertThat(summary.cancelled()).isFalse();
        assertThat(summary.thresholdPercent()).isEqualTo(75.0);
        verify(dispatchService, never()).dispatch(eq(ASHA), any(), any(), any(), anyDouble());
        verify(dispatchService, never()).dispatch(eq(CHEN), any(), any(), any(), anyDouble());
    }

    @Test
    void failingDispatchDoesNotStopThePass() {
        CourseInfo course = activeCourse(null);
        givenRoster(course, ASHA, BILAL, CHEN);
        givenSnapshot(ASHA, 4, 1);
        givenSnapshot(BILAL, 4, 0);
        givenSnapshot(CHEN, 4, 2);
        when(dispatchService.dispatch(eq(ASHA), any(), any(), any(), anyDouble()))
                .thenThrow(new IllegalStateException("gateway down"));
        when(dispatchService.dispatch(eq(BILAL), any(), any(), any(), anyDouble()))
                .thenReturn(DispatchOutcome.SKIPPED_DUPLICATE);
        when(dispatchService.dispatch(eq(CHEN), any(), any(), any(), anyDouble()))
                .thenReturn(DispatchOutcome.SENT);

        AlertRunSummary summary = orchestrationService.runForCourse(COURSE_ID, WINDOW);

        assertThat(summary.violations()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.skippedDuplicate()).isEqualTo(1);
        assertThat(summary.alerted()).isEqualTo(1);
    }

    @Test
    void courseOverrideReplacesGlobalThreshold() {
        CourseInfo course = activeCourse(90.0);
        givenRoster(course, ASHA);
        givenSnapshot(ASHA, 10, 8);
        when(dispatchService.dispatch(eq(ASHA), eq(course), eq(WINDOW), any(), eq(90.0)))
                .thenReturn(DispatchOutcome.SENT);

        AlertRunSummary summary = orchestrationService.runForCourse(COURSE_ID, WINDOW);

        assertThat(summary.thresholdPercent()).isEqualTo(90.0);
        assertThat(summary.alerted()).isEqualTo(1);
    }

    @Test
    void configuredWindowIsUsedByDefault() {
        CourseInfo course = activeCourse(null);
        when(windowResolver.currentWindow()).thenReturn(WINDOW);
        givenRoster(course);

        AlertRunSummary summary = orchestrationService.runForCourse(COURSE_ID);

        assertThat(summary.window()).isEqualTo(WINDOW);
        assertThat(summary.evaluated()).isZero();
    }

    @Test
    void missingOrInactiveCourseIsRejected() {
        when(rosterDirectory.findCourse(COURSE_ID)).thenReturn(Optional.empty());
        when(rosterDirectory.findCourse(8L))
                .thenReturn(Optional.of(new CourseInfo(8L, "Archived", null, false, null)));

        assertThatThrownBy(() -> orchestrationService.runForCourse(COURSE_ID, WINDOW))
                .isInstanceOf(CourseNotFoundException.class);
        assertThatThrownBy(() -> orchestrationService.runForCourse(8L, WINDOW))
                .isInstanceOf(CourseNotFoundException.class);
    }

    @Test
    void storeFailureWhileMeasuringPropagates() {
        CourseInfo course = activeCourse(null);
        givenRoster(course, ASHA);
        when(aggregationService.computeSnapshot(ASHA.studentId(), COURSE_ID, WINDOW))
                .thenThrow(new DataAccessResourceFailureException("database unavailable"));

        assertThatThrownBy(() -> orchestrationService.runForCourse(COURSE_ID, WINDOW))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void storeFailureWhileDispatchingPropagates() {
        CourseInfo course = activeCourse(null);
        givenRoster(course, ASHA, BILAL);
        givenSnapshot(ASHA, 4, 1);
        when(dispatchService.dispatch(eq(ASHA), any(), any(), any(), anyDouble()))
                .thenThrow(new DataAccessResourceFailureException("alert store unavailable"));

        assertThatThrownBy(() -> orchestrationService.runForCourse(COURSE_ID, WINDOW))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(aggregationService, never()).computeSnapshot(eq(BILAL.studentId()), any(), any());
    }

    @Test
    void parallelPassProducesSameCounts() {
        properties.getAlerts().setParallelThreads(4);
        CourseInfo course = activeCourse(null);
        givenRoster(course, ASHA, BILAL, CHEN);
        givenSnapshot(ASHA, 2, 2);
        givenSnapshot(BILAL, 2, 1);
        givenSnapshot(CHEN, 2, 0);
        when(dispatchService.dispatch(any(), any(), any(), any(), anyDouble())).thenReturn(DispatchOutcome.SENT);

        AlertRunSummary summary = orchestrationService.runForCourse(COURSE_ID, WINDOW);

        assertThat(summary.evaluated()).isEqualTo(3);
        assertThat(summary.compliant()).isEqualTo(1);
        assertThat(summary.alerted()).isEqualTo(2);
    }

    @Test
    void interruptCancelsRemainingStudents() {
        CourseInfo course = activeCourse(null);
        givenRoster(course, ASHA, BILAL, CHEN);
        givenSnapshot(ASHA, 4, 1);
        when(dispatchService.dispatch(eq(ASHA), any(), any(), any(), anyDouble())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return DispatchOutcome.SENT;
        });

        AlertRunSummary summary = orchestrationService.runForCourse(COURSE_ID, WINDOW);

        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.evaluated()).isEqualTo(1);
        assertThat(summary.alerted()).isEqualTo(1);
        verify(aggregationService, never()).computeSnapshot(eq(BILAL.studentId()), any(), any());
    }

    private CourseInfo activeCourse(Double thresholdOverride) {
        return new CourseInfo(COURSE_ID, "Data Structures", 50L, true, thresholdOverride);
    }

    private void givenRoster(CourseInfo course, StudentContact... students) {
        when(rosterDirectory.findCourse(COURSE_ID)).thenReturn(Optional.of(course));
        when(rosterDirectory.activeStudents(COURSE_ID)).thenReturn(List.of(students));
    }

    private void givenSnapshot(StudentContact student, long total, long present) {
        when(aggregationService.computeSnapshot(student.studentId(), COURSE_ID, WINDOW))
                .thenReturn(new ComplianceSnapshot(student.studentId(), COURSE_ID, WINDOW, total, present));
    }
}
