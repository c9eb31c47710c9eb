package com.face.attendance.audit;

/**
 * Auditable events of the attendance engine.
 */
public enum AuditAction {
    SUBMISSION_COMPLETED,
    SUBMISSION_FAILED,
    ATTENDANCE_INSERTED,
    ATTENDANCE_UPGRADED,
    SIGNATURE_ENROLLED,
    SIGNATURE_REPLACED,
    SIGNATURE_REMOVED,
    ENROLLMENT_FAILED
}
