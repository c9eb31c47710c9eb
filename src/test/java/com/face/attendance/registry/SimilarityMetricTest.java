package com.face.attendance.registry;

import com.face.attendance.core.model.Signature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SimilarityMetric")
class SimilarityMetricTest {

    @Nested
    @DisplayName("COSINE")
    class Cosine {

        @Test
        @DisplayName("Identical direction scores 1, orthogonal 0, opposed 0")
        void range() {
            Signature x = Signature.of(1f, 0f);
            assertEquals(1.0, SimilarityMetric.COSINE.similarity(x, Signature.of(3f, 0f)), 1e-9);
            assertEquals(0.0, SimilarityMetric.COSINE.similarity(x, Signature.of(0f, 2f)), 1e-9);
            assertEquals(0.0, SimilarityMetric.COSINE.similarity(x, Signature.of(-1f, 0f)), 1e-9);
        }

        @Test
        @DisplayName("A zero vector is similar to nothing")
        void zeroVector() {
            assertEquals(0.0, SimilarityMetric.COSINE.similarity(Signature.of(0f, 0f), Signature.of(1f, 1f)));
        }

        @ParameterizedTest
        @CsvSource({"0.0, 1.0", "0.18, 0.82", "1.0, 0.0", "2.0, 0.0"})
        @DisplayName("Index distance 1 - cos converts back to cos")
        void fromDistance(double distance, double expected) {
            assertEquals(expected, SimilarityMetric.COSINE.fromDistance(distance), 1e-9);
        }
    }

    @Nested
    @DisplayName("EUCLIDEAN")
    class Euclidean {

        @Test
        @DisplayName("Distance 0.4 is 0.6 similar")
        void distanceToSimilarity() {
            assertEquals(0.6, SimilarityMetric.EUCLIDEAN.similarity(Signature.of(0f, 0f), Signature.of(0.4f, 0f)), 1e-6);
        }

        @Test
        @DisplayName("Distances beyond 1 clamp to 0")
        void clamp() {
            assertEquals(0.0, SimilarityMetric.EUCLIDEAN.fromDistance(1.7));
        }
    }

    @Test
    @DisplayName("Mismatched dimensions are rejected")
    void dimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> SimilarityMetric.COSINE.similarity(Signature.of(1f), Signature.of(1f, 0f)));
    }

    @Test
    @DisplayName("Parses names case-insensitively and defaults to COSINE")
    void fromString() {
        assertEquals(SimilarityMetric.EUCLIDEAN, SimilarityMetric.fromString(" euclidean "));
        assertEquals(SimilarityMetric.COSINE, SimilarityMetric.fromString(null));
        assertThrows(IllegalArgumentException.class, () -> SimilarityMetric.fromString("manhattan"));
    }
}
