package com.face.attendance.embedding;

import com.face.attendance.core.model.DetectedFace;
import com.face.attendance.core.model.FaceRegion;
import com.face.attendance.core.model.Signature;
import com.face.attendance.detection.DecodedImage;
import com.face.attendance.detection.ImageDecoder;
import com.face.attendance.logging.LogContext;
import com.face.attendance.testing.FakeFaceModel;
import com.face.attendance.testing.TestImages;
import com.face.attendance.testing.Vectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParallelEmbedder")
class ParallelEmbedderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ExecutorService executor;
    private DecodedImage image;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        image = new ImageDecoder().decode(TestImages.png(400, 200));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    private ParallelEmbedder embedder(EmbeddingGenerator generator) {
        return new ParallelEmbedder(generator, executor, Vectors.DIMENSION, TIMEOUT);
    }

    private static DetectedFace face(int index, int left) {
        return new DetectedFace(index, FaceRegion.of(left, 10, 40, 40), null);
    }

    @Test
    @DisplayName("Every face gets its own signature, in input order")
    void embedsAll() {
        FakeFaceModel model = new FakeFaceModel()
                .face(FaceRegion.of(10, 10, 40, 40), Vectors.enrolled(0))
                .face(FaceRegion.of(100, 10, 40, 40), Vectors.enrolled(1))
                .face(FaceRegion.of(200, 10, 40, 40), Vectors.enrolled(2));
        ParallelEmbedder embedder = embedder(model);

        List<DetectedFace> result = embedder.embedAll(image, List.of(face(0, 10), face(1, 100), face(2, 200)));

        assertEquals(3, result.size());
        assertEquals(Vectors.enrolled(0), result.get(0).signature());
        assertEquals(Vectors.enrolled(1), result.get(1).signature());
        assertEquals(Vectors.enrolled(2), result.get(2).signature());
        assertEquals(3, model.embedCalls());
    }

    @Test
    @DisplayName("A failing face is left without a signature, the others still embed")
    void isolatesFailures() {
        FakeFaceModel model = new FakeFaceModel()
                .face(FaceRegion.of(10, 10, 40, 40), Vectors.enrolled(0))
                .unembeddableFace(FaceRegion.of(100, 10, 40, 40));
        ParallelEmbedder embedder = embedder(model);

        List<DetectedFace> result = embedder.embedAll(image, List.of(face(0, 10), face(1, 100)));

        assertTrue(result.get(0).hasSignature());
        assertFalse(result.get(1).hasSignature());
        assertEquals(1, result.get(1).faceIndex());
    }

    @Test
    @DisplayName("A signature of the wrong dimension counts as a failure")
    void wrongDimension() {
        EmbeddingGenerator generator = new EmbeddingGenerator() {
            @Override
            public Signature embed(DecodedImage img, FaceRegion region) {
                return Signature.of(1f, 0f, 0f);
            }

            @Override
            public int dimension() {
                return Vectors.DIMENSION;
            }
        };
        ParallelEmbedder embedder = embedder(generator);

        List<DetectedFace> result = embedder.embedAll(image, List.of(face(0, 10)));

        assertFalse(result.get(0).hasSignature());
    }

    @Test
    @DisplayName("Worker threads see the caller's log context")
    void propagatesLogContext() {
        AtomicReference<String> seen = new AtomicReference<>();
        EmbeddingGenerator generator = new EmbeddingGenerator() {
            @Override
            public Signature embed(DecodedImage img, FaceRegion region) {
                seen.set(MDC.get("classId"));
                return Vectors.enrolled(0);
            }

            @Override
            public int dimension() {
                return Vectors.DIMENSION;
            }
        };
        MDC.put("classId", "bio-101");

        embedder(generator).embedAll(image, List.of(face(0, 10)));

        assertEquals("bio-101", seen.get());
    }

    @Test
    @DisplayName("No faces means no work")
    void empty() {
        FakeFaceModel model = new FakeFaceModel();

        assertTrue(embedder(model).embedAll(image, List.of()).isEmpty());
        assertEquals(0, model.embedCalls());
    }

    @Test
    @DisplayName("Dimension must be positive")
    void invalidDimension() {
        assertThrows(IllegalArgumentException.class,
                () -> new ParallelEmbedder(new FakeFaceModel(), executor, 0, TIMEOUT));
    }

    @Test
    @DisplayName("A face still embedding at the deadline is cancelled and left without a signature")
    void hungEmbeddingTimesOut() throws InterruptedException {
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        EmbeddingGenerator generator = new EmbeddingGenerator() {
            @Override
            public Signature embed(DecodedImage img, FaceRegion region) throws EmbeddingException {
                if (region.left() == 100) {
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw new EmbeddingException("cancelled", e);
                    }
                }
                return Vectors.enrolled(0);
            }

            @Override
            public int dimension() {
                return Vectors.DIMENSION;
            }
        };
        ParallelEmbedder embedder = new ParallelEmbedder(generator, executor, Vectors.DIMENSION,
                Duration.ofMillis(200));

        long start = System.nanoTime();
        List<DetectedFace> result = embedder.embedAll(image, List.of(face(0, 10), face(1, 100)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(result.get(0).hasSignature());
        assertFalse(result.get(1).hasSignature());
        assertTrue(elapsedMs < 5_000, "embedAll returned after " + elapsedMs + "ms");
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "hung embedding was not interrupted");
    }

    @Test
    @DisplayName("Timeout must be positive")
    void invalidTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> new ParallelEmbedder(new FakeFaceModel(), executor, Vectors.DIMENSION, Duration.ZERO));
    }
}
