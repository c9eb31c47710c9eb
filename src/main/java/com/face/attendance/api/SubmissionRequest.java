package com.face.attendance.api;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One group photo submitted for attendance.
 *
 * @param classId   class the photo was taken in
 * @param date      session date
 * @param image     encoded photo bytes (JPEG, PNG, ...)
 * @param threshold similarity threshold for this session, or null for the engine default
 * @param actorId   who submitted the photo, or null for the engine default
 */
public record SubmissionRequest(String classId, LocalDate date, byte[] image, Double threshold, String actorId) {

    public SubmissionRequest {
        if (classId == null || classId.isBlank()) {
            throw new IllegalArgumentException("classId is required");
        }
        Objects.requireNonNull(date, "date is required");
        if (threshold != null) {
            EngineOptions.Builder.validateThreshold(threshold);
        }
    }

    public static SubmissionRequest of(String classId, LocalDate date, byte[] image) {
        return new SubmissionRequest(classId, date, image, null, null);
    }

    public SubmissionRequest withThreshold(double newThreshold) {
        return new SubmissionRequest(classId, date, image, newThreshold, actorId);
    }

    public SubmissionRequest withActor(String newActorId) {
        return new SubmissionRequest(classId, date, image, threshold, newActorId);
    }
}
