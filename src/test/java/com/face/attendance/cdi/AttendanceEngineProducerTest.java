package com.face.attendance.cdi;

import com.face.attendance.api.AttendanceEngine;
import com.face.attendance.api.EngineOptions;
import com.face.attendance.detection.FallbackFaceDetector;
import com.face.attendance.matching.RetryPolicy;
import com.face.attendance.model.HttpFaceModelClient;
import com.face.attendance.registry.InMemorySignatureRegistry;
import com.face.attendance.registry.SimilarityMetric;
import com.face.attendance.roster.CachingRosterProvider;
import com.face.attendance.store.InMemoryAttendanceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AttendanceEngineProducer")
class AttendanceEngineProducerTest {

    private AttendanceEngineProducer producer;

    @BeforeEach
    void setUp() {
        producer = new AttendanceEngineProducer();
        producer.threshold = 0.7;
        producer.topK = 3;
        producer.metric = "cosine";
        producer.restrictToRoster = true;
        producer.registryBackend = "memory";
        producer.registryTimeoutMs = 1500;
        producer.registryMaxAttempts = 4;
        producer.registryInitialBackoffMs = 50;
        producer.registryMaxBackoffMs = 400;
        producer.modelServerBaseUrl = "http://localhost:8500";
        producer.embeddingDimension = 128;
        producer.modelServerTimeoutSeconds = 10;
        producer.fallbackDetectorBaseUrl = Optional.empty();
        producer.rosterCacheMaxSize = 100;
        producer.rosterCacheTtlSeconds = 30;
        producer.embeddingThreads = 0;
        producer.embeddingTimeoutMs = 8000;
        producer.registryThreads = 2;
        producer.maxImageBytes = 1_000_000;
    }

    @Test
    @DisplayName("Options reflect the configured properties")
    void options() {
        EngineOptions options = producer.buildOptions();

        assertEquals(0.7, options.getThreshold());
        assertEquals(3, options.getTopK());
        assertEquals(Duration.ofMillis(1500), options.getRegistryTimeout());
        assertEquals(new RetryPolicy(4, 50, 2.0, 400), options.getRetryPolicy());
        assertEquals(1_000_000, options.getMaxImageBytes());
        assertEquals(Runtime.getRuntime().availableProcessors(), options.getEmbeddingThreads());
        assertEquals(Duration.ofSeconds(8), options.getEmbeddingTimeout());
        assertEquals(2, options.getRegistryThreads());
    }

    @Test
    @DisplayName("A positive thread count overrides the default")
    void embeddingThreads() {
        producer.embeddingThreads = 3;

        assertEquals(3, producer.buildOptions().getEmbeddingThreads());
    }

    @Test
    @DisplayName("The model client is the detector unless a fallback URL is configured")
    void fallbackDetector() {
        HttpFaceModelClient client = producer.faceModelClient();
        assertSame(client, producer.faceDetector(client));

        producer.fallbackDetectorBaseUrl = Optional.of("http://cnn:8500");
        assertInstanceOf(FallbackFaceDetector.class, producer.faceDetector(client));
    }

    @Test
    @DisplayName("The memory backend wires in-process registry and store")
    void memoryBackend() {
        CachingRosterProvider roster = producer.rosterProvider(producer.rosterSource());

        try (AttendanceEngine engine = producer.attendanceEngine(producer.faceModelClient(), roster)) {
            assertInstanceOf(InMemorySignatureRegistry.class, engine.getSignatureRegistry());
            assertInstanceOf(InMemoryAttendanceStore.class, engine.getAttendanceStore());
            assertEquals(SimilarityMetric.COSINE, engine.getSignatureRegistry().metric());
            assertEquals(128, engine.getSignatureRegistry().dimension());
        }
    }
}
