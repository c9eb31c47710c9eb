package com.face.attendance.rest.dto;

import com.face.attendance.core.model.AttendanceRecord;

/**
 * Response DTO for one stored attendance row.
 */
public record AttendanceRecordResponse(
        String classId,
        String identityId,
        String date,
        String status,
        String method,
        Double confidenceScore,
        String markedBy,
        String createdAt
) {
    public static AttendanceRecordResponse from(AttendanceRecord record) {
        return new AttendanceRecordResponse(
                record.getClassId(),
                record.getIdentityId(),
                record.getDate().toString(),
                record.getStatus().name(),
                record.getMethod().name(),
                record.getConfidenceScore(),
                record.getMarkedBy(),
                record.getCreatedAt().toString()
        );
    }
}
