package com.heronix.attendance.model.enums;

public enum UserRole {
    ADMIN,
    FACULTY,
    STUDENT
}
