package com.face.attendance.logging;

import org.slf4j.MDC;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Try-with-resources wrapper around the SLF4J MDC. Entries put through a context
 * are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSubmission(submissionId, classId, date)) {
 *     log.info("submission.completed facesDetected={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSubmission(String submissionId, String classId, LocalDate date) {
        LogContext ctx = new LogContext();
        ctx.put("submissionId", submissionId);
        ctx.put("classId", classId);
        ctx.put("date", String.valueOf(date));
        ctx.put("operation", "submit");
        return ctx;
    }

    public static LogContext forEnrollment(String identityId) {
        LogContext ctx = new LogContext();
        ctx.put("identityId", identityId);
        ctx.put("operation", "enroll");
        return ctx;
    }

    public static String generateSubmissionId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    /**
     * Wraps a task so it runs on a worker thread with the caller's MDC entries.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
