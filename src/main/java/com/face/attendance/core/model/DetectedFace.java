package com.face.attendance.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A face found in one submitted photo. Lives only for the duration of the submission.
 * The signature is absent when embedding the face failed.
 */
public record DetectedFace(int faceIndex, FaceRegion region, Signature signature) {

    public DetectedFace {
        if (faceIndex < 0) {
            throw new IllegalArgumentException("faceIndex must be >= 0");
        }
        Objects.requireNonNull(region, "region is required");
    }

    public Optional<Signature> signatureIfPresent() {
        return Optional.ofNullable(signature);
    }

    public boolean hasSignature() {
        return signature != null;
    }

    public DetectedFace withSignature(Signature newSignature) {
        return new DetectedFace(faceIndex, region, newSignature);
    }
}
