package com.face.attendance.rest.dto;

import com.face.attendance.api.SubmissionResult;

import java.util.List;

/**
 * Response DTO for a photo submission.
 */
public record SubmissionResponse(
        boolean success,
        String submissionId,
        String classId,
        String date,
        int facesDetected,
        int facesRecognized,
        int facesUnrecognized,
        List<Recognized> recognizedStudents,
        List<Unrecognized> unrecognizedFaces,
        int inserted,
        int upgraded,
        int unchanged,
        String message,
        String errorCode,
        boolean retryable
) {
    public record Recognized(String identityId, int faceIndex, double similarityScore) {}

    public record Unrecognized(int faceIndex, String reason) {}

    public static SubmissionResponse from(SubmissionResult result) {
        return new SubmissionResponse(
                result.isSuccess(),
                result.getSubmissionId(),
                result.getClassId(),
                result.getDate() != null ? result.getDate().toString() : null,
                result.getFacesDetected(),
                result.getFacesRecognized(),
                result.getFacesUnrecognized(),
                result.getRecognizedStudents().stream()
                        .map(s -> new Recognized(s.identityId(), s.faceIndex(), s.similarityScore()))
                        .toList(),
                result.getUnrecognizedFaces().stream()
                        .map(f -> new Unrecognized(f.faceIndex(), f.reason() != null ? f.reason().name() : null))
                        .toList(),
                result.getInserted(),
                result.getUpgraded(),
                result.getUnchanged(),
                result.getMessage(),
                result.getErrorCode() != null ? result.getErrorCode().name() : null,
                result.isRetryable()
        );
    }
}
