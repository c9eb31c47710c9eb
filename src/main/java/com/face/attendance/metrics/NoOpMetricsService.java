package com.face.attendance.metrics;

import com.face.attendance.core.model.UnrecognizedReason;
import com.face.attendance.store.WriteOutcome;

import java.time.Duration;

/**
 * Discards all metrics.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSubmissionDuration(String outcome, Duration duration) {}

    @Override
    public void recordFaceCounts(int detected, int recognized, int unrecognized) {}

    @Override
    public void incrementUnrecognized(UnrecognizedReason reason) {}

    @Override
    public void recordSimilarityScore(double score) {}

    @Override
    public void incrementRegistryRetry() {}

    @Override
    public void incrementAttendanceWrite(WriteOutcome outcome) {}

    @Override
    public void incrementEnrollment(boolean success) {}
}
