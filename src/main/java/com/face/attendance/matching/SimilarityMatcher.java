package com.face.attendance.matching;

import com.face.attendance.core.model.DetectedFace;
import com.face.attendance.core.model.MatchCandidate;
import com.face.attendance.core.model.UnrecognizedReason;
import com.face.attendance.logging.LogContext;
import com.face.attendance.metrics.MetricsService;
import com.face.attendance.metrics.NoOpMetricsService;
import com.face.attendance.registry.RegistryMatch;
import com.face.attendance.registry.RegistryUnavailableException;
import com.face.attendance.registry.SignatureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Turns the faces of one photo into match candidates.
 *
 * <p>Each face with a signature is queried against the registry for its top-k
 * identities. All queries of an attempt run in parallel on the supplied executor
 * and share one timeout; queries still running when it expires are cancelled and
 * the attempt fails. Failed attempts are retried according to the
 * {@link RetryPolicy}. Hits under the threshold are dropped here, as are hits for
 * identities outside the roster when one is given.</p>
 */
public class SimilarityMatcher {
    private static final Logger log = LoggerFactory.getLogger(SimilarityMatcher.class);

    private final SignatureRegistry registry;
    private final ExecutorService executor;
    private final int topK;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final MetricsService metrics;
    private final Sleeper sleeper;

    public SimilarityMatcher(SignatureRegistry registry, ExecutorService executor, int topK,
                             Duration timeout, RetryPolicy retryPolicy) {
        this(registry, executor, topK, timeout, retryPolicy, new NoOpMetricsService(), Sleeper.THREAD);
    }

    public SimilarityMatcher(SignatureRegistry registry, ExecutorService executor, int topK,
                             Duration timeout, RetryPolicy retryPolicy, MetricsService metrics,
                             Sleeper sleeper) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.topK = topK;
        this.timeout = timeout;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
    }

    /**
     * @param faces     the detected faces, some possibly without a signature
     * @param threshold minimum similarity for a candidate, in [0,1]
     * @param roster    identities allowed to be matched, or null for no restriction
     * @throws RegistryUnavailableException when every attempt failed or timed out
     */
    public CandidateSet match(List<DetectedFace> faces, double threshold, Set<String> roster) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        Map<Integer, UnrecognizedReason> missReasons = new HashMap<>();
        List<DetectedFace> queryable = new ArrayList<>();
        for (DetectedFace face : faces) {
            if (face.hasSignature()) {
                queryable.add(face);
            } else {
                missReasons.put(face.faceIndex(), UnrecognizedReason.EMBEDDING_FAILED);
            }
        }
        if (queryable.isEmpty()) {
            return new CandidateSet(List.of(), missReasons, 0, 0);
        }

        int attempt = 0;
        RuntimeException lastFailure = null;
        while (attempt < retryPolicy.maxAttempts()) {
            attempt++;
            try {
                Map<Integer, List<RegistryMatch>> hits = queryAll(queryable);
                return filter(queryable, hits, threshold, roster, missReasons, attempt);
            } catch (RegistryUnavailableException e) {
                lastFailure = e;
                log.warn("matcher.attempt.failed attempt={}/{} reason={}",
                        attempt, retryPolicy.maxAttempts(), e.getMessage());
                if (attempt < retryPolicy.maxAttempts()) {
                    metrics.incrementRegistryRetry();
                    pause(retryPolicy.backoffAfter(attempt));
                }
            }
        }
        throw new RegistryUnavailableException("Signature registry unavailable after "
                + attempt + " attempt(s): " + lastFailure.getMessage(), lastFailure);
    }

    private Map<Integer, List<RegistryMatch>> queryAll(List<DetectedFace> faces) {
        List<Callable<List<RegistryMatch>>> tasks = new ArrayList<>(faces.size());
        for (DetectedFace face : faces) {
            tasks.add(LogContext.propagate(() -> registry.query(face.signature(), topK)));
        }

        List<Future<List<RegistryMatch>>> futures;
        try {
            // invokeAll cancels every task still running when the timeout expires
            futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException("Interrupted while querying signature registry", e);
        }

        Map<Integer, List<RegistryMatch>> hits = new HashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            Future<List<RegistryMatch>> future = futures.get(i);
            try {
                hits.put(faces.get(i).faceIndex(), future.get());
            } catch (CancellationException e) {
                throw new RegistryUnavailableException(
                        "Signature registry did not answer within " + timeout.toMillis() + "ms", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RegistryUnavailableException rue) {
                    throw rue;
                }
                if (cause instanceof IllegalArgumentException iae) {
                    throw iae;
                }
                throw new RegistryUnavailableException("Signature registry query failed: " + cause, cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegistryUnavailableException("Interrupted while querying signature registry", e);
            }
        }
        return hits;
    }

    private CandidateSet filter(List<DetectedFace> faces, Map<Integer, List<RegistryMatch>> hits,
                                double threshold, Set<String> roster,
                                Map<Integer, UnrecognizedReason> missReasons, int attempts) {
        List<MatchCandidate> candidates = new ArrayList<>();
        int belowThreshold = 0;
        for (DetectedFace face : faces) {
            List<RegistryMatch> faceHits = hits.getOrDefault(face.faceIndex(), List.of());
            boolean anyAbove = false;
            boolean anyAccepted = false;
            for (RegistryMatch hit : faceHits) {
                if (hit.similarity() < threshold) {
                    belowThreshold++;
                    continue;
                }
                anyAbove = true;
                if (roster != null && !roster.contains(hit.identityId())) {
                    log.debug("matcher.off_roster faceIndex={} identityId={}", face.faceIndex(), hit.identityId());
                    continue;
                }
                anyAccepted = true;
                candidates.add(new MatchCandidate(face.faceIndex(), hit.identityId(), hit.similarity()));
            }
            if (!anyAccepted) {
                UnrecognizedReason reason;
                if (faceHits.isEmpty()) {
                    reason = UnrecognizedReason.NO_CANDIDATE;
                } else if (anyAbove) {
                    reason = UnrecognizedReason.NOT_ON_ROSTER;
                } else {
                    reason = UnrecognizedReason.BELOW_THRESHOLD;
                }
                missReasons.put(face.faceIndex(), reason);
            }
        }
        log.debug("matcher.completed faces={} candidates={} belowThreshold={} attempts={}",
                faces.size(), candidates.size(), belowThreshold, attempts);
        return new CandidateSet(candidates, missReasons, belowThreshold, attempts);
    }

    private void pause(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException("Interrupted during registry retry backoff", e);
        }
    }

    public int getTopK() {
        return topK;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Pause between retries; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = d -> Thread.sleep(d.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
