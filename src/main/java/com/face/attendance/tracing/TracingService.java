package com.face.attendance.tracing;

import java.util.Map;

/**
 * Starts spans around submission and enrollment stages.
 * {@link NoOpTracingService} is used when no tracer is configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
