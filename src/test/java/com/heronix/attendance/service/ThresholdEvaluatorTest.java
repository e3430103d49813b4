package com.heronix.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.heronix.attendance.model.dto.AttendanceWindow;
import com.heronix.attendance.model.dto.ComplianceSnapshot;
import com.heronix.attendance.model.enums.Verdict;

class ThresholdEvaluatorTest {

    private static final AttendanceWindow WINDOW = AttendanceWindow.of("2025-01-01", "2025-01-31");

    private final ThresholdEvaluator evaluator = new ThresholdEvaluator();

    private static ComplianceSnapshot snapshot(long total, long present) {
        return new ComplianceSnapshot(1L, 10L, WINDOW, total, present);
    }

    @Test
    void noRecordsIsNoDataNotZeroPercent() {
        ComplianceSnapshot empty = snapshot(0, 0);

        assertThat(empty.percentage()).isEmpty();
        assertThat(evaluator.evaluate(empty, 75)).isEqualTo(Verdict.NO_DATA);
    }

    @Test
    void percentageEqualToThresholdIsCompliant() {
        assertThat(evaluator.evaluate(snapshot(4, 3), 75)).isEqualTo(Verdict.COMPLIANT);
        assertThat(evaluator.classify(75.0, 75)).isEqualTo(Verdict.COMPLIANT);
    }

    @Test
    void percentageJustBelowThresholdIsViolation() {
        assertThat(evaluator.evaluate(snapshot(10000, 7499), 75)).isEqualTo(Verdict.VIOLATION);
        assertThat(evaluator.classify(74.99, 75)).isEqualTo(Verdict.VIOLATION);
    }

    @Test
    void zeroAttendedOutOfSomeClassesIsViolation() {
        ComplianceSnapshot neverAttended = snapshot(5, 0);

        assertThat(neverAttended.percentage()).hasValue(0.0);
        assertThat(evaluator.evaluate(neverAttended, 75)).isEqualTo(Verdict.VIOLATION);
    }

    @Test
    void fullAttendanceIsCompliant() {
        assertThat(evaluator.evaluate(snapshot(8, 8), 75)).isEqualTo(Verdict.COMPLIANT);
    }

    @Test
    void thresholdIsAParameter() {
        ComplianceSnapshot eightyPercent = snapshot(5, 4);

        assertThat(evaluator.evaluate(eightyPercent, 75)).isEqualTo(Verdict.COMPLIANT);
        assertThat(evaluator.evaluate(eightyPercent, 90)).isEqualTo(Verdict.VIOLATION);
    }
}
