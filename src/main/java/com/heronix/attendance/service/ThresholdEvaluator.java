package com.heronix.attendance.service;

import org.springframework.stereotype.Component;

import com.heronix.attendance.model.dto.ComplianceSnapshot;
import com.heronix.attendance.model.enums.Verdict;

/**
 * Maps an attendance snapshot and a threshold to a compliance verdict.
 *
 * Pure and stateless; safe to call from any thread.
 */
@Component
public class ThresholdEvaluator {

    /**
     * Classify a snapshot.
     *
     * @param snapshot         attendance counts for one student
     * @param thresholdPercent minimum compliant percentage
     * @return NO_DATA when no classes were recorded, VIOLATION when the percentage is
     *         strictly below the threshold (0% included), COMPLIANT otherwise
     */
    public Verdict evaluate(ComplianceSnapshot snapshot, double thresholdPercent) {
        if (snapshot == null || !snapshot.hasData()) {
            return Verdict.NO_DATA;
        }
        return classify(snapshot.percentage().getAsDouble(), thresholdPercent);
    }

    /**
     * Classify a measured percentage; equality with the threshold is compliant.
     */
    public Verdict classify(double percentage, double thresholdPercent) {
        return percentage < thresholdPercent ? Verdict.VIOLATION : Verdict.COMPLIANT;
    }
}
