package com.face.attendance.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOp {

        @Test
        @DisplayName("Spans can be used and closed")
        void lifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("attendance.detect", Map.of("classId", "bio-101"))) {
                    span.setAttribute("faces", 3L);
                    span.setAttribute("threshold", 0.6);
                    span.addEvent("retry");
                    span.recordException(new IllegalStateException("x"));
                    span.setStatus(Span.SpanStatus.ERROR);
                }
            });
        }

        @Test
        @DisplayName("Every span is the same shared instance")
        void shared() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("a"), noOp.startSpan("b"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OpenTelemetry {

        private final Tracer tracer = mock(Tracer.class);
        private final SpanBuilder builder = mock(SpanBuilder.class);
        private final io.opentelemetry.api.trace.Span otelSpan = mock(io.opentelemetry.api.trace.Span.class);

        @Test
        @DisplayName("Attributes are set on the builder and the span ends on close")
        void attributesAndEnd() {
            when(tracer.spanBuilder("attendance.submit")).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);

            Span span = new OpenTelemetryTracingService(tracer)
                    .startSpan("attendance.submit", Map.of("classId", "bio-101"));
            span.setAttribute("faces", 2L);
            span.setStatus(Span.SpanStatus.OK);
            span.close();

            verify(builder).setAttribute("classId", "bio-101");
            verify(otelSpan).setAttribute("faces", 2L);
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Errors are recorded on the span")
        void errors() {
            when(tracer.spanBuilder("attendance.match")).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            RuntimeException failure = new RuntimeException("timeout");

            try (Span span = new OpenTelemetryTracingService(tracer).startSpan("attendance.match")) {
                span.recordException(failure);
                span.setStatus(Span.SpanStatus.ERROR);
            }

            verify(otelSpan).recordException(failure);
            verify(otelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("A tracer is required")
        void requiresTracer() {
            assertThrows(NullPointerException.class, () -> new OpenTelemetryTracingService(null));
        }
    }
}
