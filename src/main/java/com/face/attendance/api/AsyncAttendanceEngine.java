package com.face.attendance.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking view of an {@link AttendanceEngine}. Each call runs on a bounded
 * executor and fails with a {@link java.util.concurrent.TimeoutException} when it
 * exceeds the configured overall timeout.
 */
public interface AsyncAttendanceEngine extends AutoCloseable {

    CompletableFuture<SubmissionResult> submitAsync(SubmissionRequest request);

    /**
     * Submits several photos; results are in request order.
     */
    CompletableFuture<List<SubmissionResult>> submitAllAsync(List<SubmissionRequest> requests);

    CompletableFuture<EnrollmentResult> enrollAsync(EnrollmentRequest request);

    @Override
    void close();
}
