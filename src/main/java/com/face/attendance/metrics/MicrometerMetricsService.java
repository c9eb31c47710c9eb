package com.face.attendance.metrics;

import com.face.attendance.core.model.UnrecognizedReason;
import com.face.attendance.store.WriteOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code attendance.submission.duration} Timer (tag: outcome)</li>
 *   <li>{@code attendance.faces.detected}, {@code .recognized}, {@code .unrecognized} Counters</li>
 *   <li>{@code attendance.faces.unrecognized.reason} Counter (tag: reason)</li>
 *   <li>{@code attendance.similarity.score} DistributionSummary</li>
 *   <li>{@code attendance.registry.retries} Counter</li>
 *   <li>{@code attendance.writes} Counter (tag: outcome)</li>
 *   <li>{@code attendance.enrollments} Counter (tag: result)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter facesDetected;
    private final Counter facesRecognized;
    private final Counter facesUnrecognized;
    private final Counter registryRetries;
    private final DistributionSummary similarityScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.facesDetected = Counter.builder("attendance.faces.detected")
                .description("Faces found in submitted photos")
                .register(registry);
        this.facesRecognized = Counter.builder("attendance.faces.recognized")
                .description("Faces credited to an enrolled identity")
                .register(registry);
        this.facesUnrecognized = Counter.builder("attendance.faces.unrecognized")
                .description("Faces that could not be credited")
                .register(registry);
        this.registryRetries = Counter.builder("attendance.registry.retries")
                .description("Signature registry query attempts that were retried")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("attendance.similarity.score")
                .description("Similarity of accepted face matches")
                .register(registry);
    }

    @Override
    public void recordSubmissionDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("attendance.submission.duration")
                        .description("Duration of photo attendance submissions")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordFaceCounts(int detected, int recognized, int unrecognized) {
        facesDetected.increment(detected);
        facesRecognized.increment(recognized);
        facesUnrecognized.increment(unrecognized);
    }

    @Override
    public void incrementUnrecognized(UnrecognizedReason reason) {
        counter("attendance.faces.unrecognized.reason", "reason", reason.name(),
                "Unrecognized faces by reason").increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void incrementRegistryRetry() {
        registryRetries.increment();
    }

    @Override
    public void incrementAttendanceWrite(WriteOutcome outcome) {
        counter("attendance.writes", "outcome", outcome.name(),
                "Attendance rows by write outcome").increment();
    }

    @Override
    public void incrementEnrollment(boolean success) {
        counter("attendance.enrollments", "result", success ? "success" : "failure",
                "Signature enrollments").increment();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
