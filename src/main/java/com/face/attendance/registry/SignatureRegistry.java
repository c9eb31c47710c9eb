package com.face.attendance.registry;

import com.face.attendance.core.model.Signature;

import java.util.List;

/**
 * Holds at most one live signature per enrolled identity and answers
 * nearest-neighbour queries against them.
 *
 * <p>Every operation may throw {@link RegistryUnavailableException} when the
 * backing store cannot be reached.</p>
 */
public interface SignatureRegistry {

    /**
     * Stores the signature for an identity, replacing any previous one atomically.
     * Repeating the call with the same arguments leaves the registry unchanged.
     *
     * @return true if a previous signature was replaced
     * @throws IllegalArgumentException if the signature dimension does not match {@link #dimension()}
     */
    boolean upsert(String identityId, Signature signature);

    /**
     * Returns up to {@code topK} identities most similar to the given signature,
     * best first; equal similarities are ordered by identity id.
     */
    List<RegistryMatch> query(Signature signature, int topK);

    /**
     * Removes an identity's signature.
     *
     * @return true if the identity was enrolled
     */
    boolean remove(String identityId);

    boolean contains(String identityId);

    int size();

    /**
     * Dimension every stored signature must have.
     */
    int dimension();

    SimilarityMetric metric();

    /**
     * Cheap liveness check used by health checks.
     */
    default boolean isAvailable() {
        return true;
    }
}
