package com.face.attendance.api;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@link AsyncAttendanceEngine} running whole submissions on a fixed thread pool.
 */
public class AsyncAttendanceEngineImpl implements AsyncAttendanceEngine {

    private final AttendanceEngine engine;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncAttendanceEngineImpl(AttendanceEngine engine, int threads, long timeoutMs) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.executor = Executors.newFixedThreadPool(threads, AttendanceEngine.namedThreads("attendance-async"));
        this.timeoutMs = timeoutMs;
    }

    @Override
    public CompletableFuture<SubmissionResult> submitAsync(SubmissionRequest request) {
        return CompletableFuture.supplyAsync(() -> engine.submit(request), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<SubmissionResult>> submitAllAsync(List<SubmissionRequest> requests) {
        List<CompletableFuture<SubmissionResult>> futures = requests.stream()
                .map(this::submitAsync)
                .toList();
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public CompletableFuture<EnrollmentResult> enrollAsync(EnrollmentRequest request) {
        return CompletableFuture.supplyAsync(() -> engine.enroll(request), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
