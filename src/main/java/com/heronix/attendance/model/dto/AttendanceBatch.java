package com.heronix.attendance.model.dto;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the per-student presence map consumed by batch attendance recording.
 */
public final class AttendanceBatch {

    private AttendanceBatch() {
    }

    /**
     * Convert a roster plus the subset marked present into studentId -> present.
     *
     * Every roster entry maps to exactly one boolean; ids in {@code presentIds} that are
     * not on the roster are ignored. Roster order is preserved.
     */
    public static Map<Long, Boolean> fromRoster(List<Long> rosterIds, Collection<Long> presentIds) {
        Set<Long> present = presentIds == null ? Set.of() : new HashSet<>(presentIds);
        Map<Long, Boolean> presence = new LinkedHashMap<>();
        if (rosterIds == null) {
            return presence;
        }
        for (Long studentId : rosterIds) {
            if (studentId != null) {
                presence.put(studentId, present.contains(studentId));
            }
        }
        return presence;
    }
}
