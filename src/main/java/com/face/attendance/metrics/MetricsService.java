package com.face.attendance.metrics;

import com.face.attendance.core.model.UnrecognizedReason;
import com.face.attendance.store.WriteOutcome;

import java.time.Duration;

/**
 * Records attendance engine metrics.
 * The default {@link NoOpMetricsService} lets the library run without a metrics backend.
 */
public interface MetricsService {

    /**
     * @param outcome {@code success} or the failure error code
     */
    void recordSubmissionDuration(String outcome, Duration duration);

    void recordFaceCounts(int detected, int recognized, int unrecognized);

    void incrementUnrecognized(UnrecognizedReason reason);

    void recordSimilarityScore(double score);

    void incrementRegistryRetry();

    void incrementAttendanceWrite(WriteOutcome outcome);

    void incrementEnrollment(boolean success);
}
