package com.heronix.attendance.model.dto;

import com.heronix.attendance.model.enums.UserRole;

/**
 * Identity of the caller performing an attendance write.
 *
 * Authorization is decided by the calling layer; the ledger only records who marked what.
 */
public record AttendanceActor(Long userId, UserRole role) {

    private static final AttendanceActor SYSTEM = new AttendanceActor(null, UserRole.ADMIN);

    public static AttendanceActor faculty(Long userId) {
        return new AttendanceActor(userId, UserRole.FACULTY);
    }

    public static AttendanceActor admin(Long userId) {
        return new AttendanceActor(userId, UserRole.ADMIN);
    }

    /**
     * Actor for writes made by scheduled or migration jobs with no human caller.
     */
    public static AttendanceActor system() {
        return SYSTEM;
    }
}
