package com.face.attendance.api;

/**
 * Outcome of an enrollment.
 *
 * @param replaced      true when an earlier signature of the identity was replaced
 * @param facesDetected faces found in the portrait; the largest one is enrolled
 * @param errorCode     set only on failure
 */
public record EnrollmentResult(
        boolean success,
        String identityId,
        boolean replaced,
        int facesDetected,
        String message,
        ErrorCode errorCode
) {

    public static EnrollmentResult enrolled(String identityId, boolean replaced, int facesDetected) {
        return new EnrollmentResult(true, identityId, replaced, facesDetected,
                replaced ? "Face signature updated" : "Face signature enrolled", null);
    }

    public static EnrollmentResult failed(String identityId, int facesDetected, String message, ErrorCode errorCode) {
        return new EnrollmentResult(false, identityId, false, facesDetected, message, errorCode);
    }

    public boolean retryable() {
        return errorCode != null && errorCode.isRetryable();
    }
}
