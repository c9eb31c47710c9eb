package com.face.attendance.embedding;

import com.face.attendance.core.model.DetectedFace;
import com.face.attendance.core.model.Signature;
import com.face.attendance.detection.DecodedImage;
import com.face.attendance.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Embeds all faces of one photo in parallel on a bounded executor.
 *
 * <p>A face whose embedding throws, comes back with the wrong dimension, or is not
 * done when the deadline expires is returned without a signature; the other faces
 * are unaffected. Embeddings still running at the deadline are cancelled.</p>
 */
public class ParallelEmbedder {
    private static final Logger log = LoggerFactory.getLogger(ParallelEmbedder.class);

    private final EmbeddingGenerator generator;
    private final ExecutorService executor;
    private final int expectedDimension;
    private final Duration timeout;

    public ParallelEmbedder(EmbeddingGenerator generator, ExecutorService executor, int expectedDimension,
                            Duration timeout) {
        this.generator = Objects.requireNonNull(generator, "generator is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        if (expectedDimension <= 0) {
            throw new IllegalArgumentException("expectedDimension must be positive");
        }
        this.expectedDimension = expectedDimension;
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    /**
     * @return the faces in input order, each with a signature unless embedding it failed
     */
    public List<DetectedFace> embedAll(DecodedImage image, List<DetectedFace> faces) {
        List<Callable<Signature>> tasks = new ArrayList<>(faces.size());
        for (DetectedFace face : faces) {
            tasks.add(LogContext.propagate(() -> generator.embed(image, face.region())));
        }

        List<Future<Signature>> futures;
        try {
            futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while embedding faces", e);
        }

        List<DetectedFace> embedded = new ArrayList<>(faces.size());
        for (int i = 0; i < faces.size(); i++) {
            DetectedFace face = faces.get(i);
            embedded.add(face.withSignature(signatureOrNull(face, futures.get(i))));
        }
        return embedded;
    }

    private Signature signatureOrNull(DetectedFace face, Future<Signature> future) {
        try {
            Signature signature = future.get();
            if (signature == null) {
                log.warn("embedding.empty faceIndex={}", face.faceIndex());
                return null;
            }
            if (signature.dimension() != expectedDimension) {
                log.warn("embedding.dimension_mismatch faceIndex={} expected={} actual={}",
                        face.faceIndex(), expectedDimension, signature.dimension());
                return null;
            }
            return signature;
        } catch (CancellationException e) {
            log.warn("embedding.timeout faceIndex={} timeoutMs={}", face.faceIndex(), timeout.toMillis());
            return null;
        } catch (ExecutionException e) {
            log.warn("embedding.failed faceIndex={} error={}", face.faceIndex(), e.getCause().getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while embedding faces", e);
        }
    }
}
