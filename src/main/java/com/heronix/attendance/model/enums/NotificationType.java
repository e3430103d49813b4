package com.heronix.attendance.model.enums;

/**
 * Category of an in-app notification.
 */
public enum NotificationType {
    ATTENDANCE_ALERT,
    SYSTEM,
    INFO
}
