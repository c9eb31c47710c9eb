package com.face.attendance.registry;

import java.util.Comparator;

/**
 * One nearest-neighbour hit: an enrolled identity and its similarity in [0,1].
 */
public record RegistryMatch(String identityId, double similarity) {

    /**
     * Similarity descending, then identity ascending.
     */
    public static final Comparator<RegistryMatch> BEST_FIRST =
            Comparator.comparingDouble(RegistryMatch::similarity).reversed()
                    .thenComparing(RegistryMatch::identityId);

    public RegistryMatch {
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("identityId is required");
        }
        if (Double.isNaN(similarity)) {
            throw new IllegalArgumentException("similarity must be a number");
        }
        similarity = Math.max(0.0, Math.min(1.0, similarity));
    }
}
