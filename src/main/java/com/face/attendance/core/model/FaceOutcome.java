package com.face.attendance.core.model;

/**
 * Per-face result of one submission. Exactly two variants exist:
 * {@link Recognized} and {@link Unrecognized}.
 */
public interface FaceOutcome {

    int faceIndex();

    boolean isRecognized();

    /**
     * The face was credited to an enrolled identity.
     */
    record Recognized(int faceIndex, String identityId, double similarityScore) implements FaceOutcome {
        @Override
        public boolean isRecognized() {
            return true;
        }
    }

    /**
     * The face could not be credited to anyone.
     */
    record Unrecognized(int faceIndex, UnrecognizedReason reason) implements FaceOutcome {
        @Override
        public boolean isRecognized() {
            return false;
        }
    }
}
