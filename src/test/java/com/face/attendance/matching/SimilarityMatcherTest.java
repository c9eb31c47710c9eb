package com.face.attendance.matching;

import com.face.attendance.core.model.DetectedFace;
import com.face.attendance.core.model.FaceRegion;
import com.face.attendance.core.model.MatchCandidate;
import com.face.attendance.core.model.Signature;
import com.face.attendance.core.model.UnrecognizedReason;
import com.face.attendance.metrics.MetricsService;
import com.face.attendance.registry.RegistryMatch;
import com.face.attendance.registry.RegistryUnavailableException;
import com.face.attendance.registry.SignatureRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SimilarityMatcher")
class SimilarityMatcherTest {

    private static final Signature FACE_0 = Signature.of(1f, 0f);
    private static final Signature FACE_1 = Signature.of(0f, 1f);

    @Mock
    private SignatureRegistry registry;

    @Mock
    private MetricsService metrics;

    private ExecutorService executor;
    private final List<Duration> pauses = new ArrayList<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SimilarityMatcher matcher(RetryPolicy retryPolicy, Duration timeout) {
        return new SimilarityMatcher(registry, executor, 5, timeout, retryPolicy, metrics, pauses::add);
    }

    private static List<DetectedFace> faces() {
        return List.of(
                new DetectedFace(0, FaceRegion.of(0, 0, 10, 10), FACE_0),
                new DetectedFace(1, FaceRegion.of(20, 0, 10, 10), FACE_1));
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("Keeps hits at or above the threshold and counts the rest")
        void threshold() {
            when(registry.query(eq(FACE_0), anyInt())).thenReturn(List.of(
                    new RegistryMatch("A", 0.82), new RegistryMatch("B", 0.60), new RegistryMatch("C", 0.59)));
            when(registry.query(eq(FACE_1), anyInt())).thenReturn(List.of(new RegistryMatch("B", 0.40)));

            CandidateSet set = matcher(RetryPolicy.none(), Duration.ofSeconds(1)).match(faces(), 0.6, null);

            assertEquals(List.of(new MatchCandidate(0, "A", 0.82), new MatchCandidate(0, "B", 0.60)),
                    set.candidates());
            assertEquals(2, set.belowThreshold());
            assertEquals(UnrecognizedReason.BELOW_THRESHOLD, set.missReasons().get(1));
            assertEquals(1, set.attempts());
        }

        @Test
        @DisplayName("An empty registry answer means NO_CANDIDATE")
        void noCandidate() {
            when(registry.query(any(), anyInt())).thenReturn(List.of());

            CandidateSet set = matcher(RetryPolicy.none(), Duration.ofSeconds(1)).match(faces(), 0.6, null);

            assertTrue(set.candidates().isEmpty());
            assertEquals(UnrecognizedReason.NO_CANDIDATE, set.missReasons().get(0));
            assertEquals(UnrecognizedReason.NO_CANDIDATE, set.missReasons().get(1));
        }

        @Test
        @DisplayName("Identities outside the roster are dropped")
        void roster() {
            when(registry.query(eq(FACE_0), anyInt())).thenReturn(List.of(
                    new RegistryMatch("X", 0.95), new RegistryMatch("A", 0.70)));
            when(registry.query(eq(FACE_1), anyInt())).thenReturn(List.of(new RegistryMatch("Y", 0.90)));

            CandidateSet set = matcher(RetryPolicy.none(), Duration.ofSeconds(1))
                    .match(faces(), 0.6, Set.of("A", "B"));

            assertEquals(List.of(new MatchCandidate(0, "A", 0.70)), set.candidates());
            assertEquals(UnrecognizedReason.NOT_ON_ROSTER, set.missReasons().get(1));
        }

        @Test
        @DisplayName("Faces without a signature are never queried")
        void missingSignature() {
            List<DetectedFace> faces = List.of(new DetectedFace(0, FaceRegion.of(0, 0, 10, 10), null));

            CandidateSet set = matcher(RetryPolicy.none(), Duration.ofSeconds(1)).match(faces, 0.6, null);

            assertEquals(UnrecognizedReason.EMBEDDING_FAILED, set.missReasons().get(0));
            verifyNoInteractions(registry);
        }

        @Test
        @DisplayName("Threshold outside [0,1] is rejected")
        void invalidThreshold() {
            SimilarityMatcher matcher = matcher(RetryPolicy.none(), Duration.ofSeconds(1));
            assertThrows(IllegalArgumentException.class, () -> matcher.match(faces(), 1.5, null));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A transient failure is retried after a backoff")
        void retry() {
            when(registry.query(eq(FACE_0), anyInt()))
                    .thenThrow(new RegistryUnavailableException("refused"))
                    .thenReturn(List.of(new RegistryMatch("A", 0.9)));
            when(registry.query(eq(FACE_1), anyInt())).thenReturn(List.of());

            CandidateSet set = matcher(RetryPolicy.defaults(), Duration.ofSeconds(1)).match(faces(), 0.6, null);

            assertEquals(2, set.attempts());
            assertEquals(1, set.candidates().size());
            assertEquals(List.of(Duration.ofMillis(100)), pauses);
            verify(metrics).incrementRegistryRetry();
        }

        @Test
        @DisplayName("Exhausted attempts surface RegistryUnavailableException")
        void exhausted() {
            when(registry.query(any(), anyInt())).thenThrow(new IllegalStateException("socket closed"));

            SimilarityMatcher matcher = matcher(new RetryPolicy(3, 10, 2.0, 100), Duration.ofSeconds(1));

            RegistryUnavailableException e = assertThrows(RegistryUnavailableException.class,
                    () -> matcher.match(faces(), 0.6, null));
            assertTrue(e.getMessage().contains("3 attempt"));
            assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), pauses);
        }

        @Test
        @DisplayName("A query slower than the timeout fails the attempt")
        void timeout() {
            when(registry.query(any(), anyInt())).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return List.of();
            });

            SimilarityMatcher matcher = matcher(RetryPolicy.none(), Duration.ofMillis(100));

            long start = System.nanoTime();
            assertThrows(RegistryUnavailableException.class, () -> matcher.match(faces(), 0.6, null));
            assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 1_500);
        }
    }
}
