package com.face.attendance.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A (face, identity, score) triple that cleared the similarity threshold.
 */
public record MatchCandidate(int faceIndex, String identityId, double similarityScore) {

    /**
     * Resolution order: score descending, then face index ascending, then identity ascending.
     */
    public static final Comparator<MatchCandidate> RESOLUTION_ORDER =
            Comparator.comparingDouble(MatchCandidate::similarityScore).reversed()
                    .thenComparingInt(MatchCandidate::faceIndex)
                    .thenComparing(MatchCandidate::identityId);

    public MatchCandidate {
        if (faceIndex < 0) {
            throw new IllegalArgumentException("faceIndex must be >= 0");
        }
        Objects.requireNonNull(identityId, "identityId is required");
        if (similarityScore < 0.0 || similarityScore > 1.0) {
            throw new IllegalArgumentException("similarityScore must be between 0.0 and 1.0");
        }
    }
}
