package com.face.attendance.core.model;

import java.util.Objects;

/**
 * A candidate accepted by the assignment resolver. Within one submission no two
 * resolved matches share a face index or an identity.
 */
public record ResolvedMatch(int faceIndex, String identityId, double similarityScore) {

    public ResolvedMatch {
        Objects.requireNonNull(identityId, "identityId is required");
    }

    public static ResolvedMatch from(MatchCandidate candidate) {
        return new ResolvedMatch(candidate.faceIndex(), candidate.identityId(), candidate.similarityScore());
    }
}
