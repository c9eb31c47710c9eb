package com.face.attendance.tracing;

/**
 * One traced pipeline stage. Closing the span ends it, so stages are traced with
 * try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startSpan("attendance.detect")) {
 *     span.setAttribute("faces", faces.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
