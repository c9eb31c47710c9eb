package com.face.attendance.registry;

import com.face.attendance.core.model.Signature;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force registry kept in memory. Thread-safe; a query sees each identity's
 * signature either before or after a concurrent upsert, never a mix.
 */
public class InMemorySignatureRegistry implements SignatureRegistry {

    private final Map<String, Signature> signatures = new ConcurrentHashMap<>();
    private final int dimension;
    private final SimilarityMetric metric;

    public InMemorySignatureRegistry(int dimension) {
        this(dimension, SimilarityMetric.COSINE);
    }

    public InMemorySignatureRegistry(int dimension, SimilarityMetric metric) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.metric = Objects.requireNonNull(metric, "metric is required");
    }

    @Override
    public boolean upsert(String identityId, Signature signature) {
        requireIdentity(identityId);
        checkDimension(signature);
        return signatures.put(identityId, signature) != null;
    }

    @Override
    public List<RegistryMatch> query(Signature signature, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        checkDimension(signature);

        // min-heap of the best topK seen so far; head is the weakest
        PriorityQueue<RegistryMatch> best = new PriorityQueue<>(topK + 1, RegistryMatch.BEST_FIRST.reversed());
        for (Map.Entry<String, Signature> entry : signatures.entrySet()) {
            best.add(new RegistryMatch(entry.getKey(), metric.similarity(signature, entry.getValue())));
            if (best.size() > topK) {
                best.poll();
            }
        }
        List<RegistryMatch> result = new ArrayList<>(best);
        result.sort(RegistryMatch.BEST_FIRST);
        return result;
    }

    @Override
    public boolean remove(String identityId) {
        requireIdentity(identityId);
        return signatures.remove(identityId) != null;
    }

    @Override
    public boolean contains(String identityId) {
        return identityId != null && signatures.containsKey(identityId);
    }

    @Override
    public int size() {
        return signatures.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public SimilarityMetric metric() {
        return metric;
    }

    public void clear() {
        signatures.clear();
    }

    private void checkDimension(Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        if (signature.dimension() != dimension) {
            throw new IllegalArgumentException("Signature dimension " + signature.dimension()
                    + " does not match registry dimension " + dimension);
        }
    }

    private static void requireIdentity(String identityId) {
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("identityId is required");
        }
    }
}
