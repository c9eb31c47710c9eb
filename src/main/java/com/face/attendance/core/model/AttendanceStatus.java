package com.face.attendance.core.model;

/**
 * Attendance status of one identity for one class session.
 */
public enum AttendanceStatus {
    PRESENT,
    ABSENT,
    LATE;

    public boolean countsAsAttended() {
        return this == PRESENT || this == LATE;
    }
}
