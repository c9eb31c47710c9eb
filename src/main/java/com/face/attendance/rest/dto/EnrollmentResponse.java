package com.face.attendance.rest.dto;

import com.face.attendance.api.EnrollmentResult;

/**
 * Response DTO for a signature enrollment.
 */
public record EnrollmentResponse(
        boolean success,
        String identityId,
        boolean replaced,
        int facesDetected,
        String message
) {
    public static EnrollmentResponse from(EnrollmentResult result) {
        return new EnrollmentResponse(result.success(), result.identityId(), result.replaced(),
                result.facesDetected(), result.message());
    }
}
