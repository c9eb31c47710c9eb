package com.face.attendance.api;

/**
 * A portrait to enroll (or re-enroll) as an identity's signature.
 */
public record EnrollmentRequest(String identityId, byte[] image, String actorId) {

    public EnrollmentRequest {
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("identityId is required");
        }
    }

    public static EnrollmentRequest of(String identityId, byte[] image) {
        return new EnrollmentRequest(identityId, image, null);
    }
}
