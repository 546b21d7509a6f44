package com.knowledge.importer.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(TracingService.IMPORT_SPAN)) {
                    span.setAttribute("import.id", "abc");
                    span.setAttribute("candidates", 42L);
                    span.setAttribute("confidence", 0.5);
                    span.fail(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2", Map.of("k", "v")));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
        }

        @Test
        @DisplayName("Should create span with the operation name and attributes")
        void createSpanWithAttributes() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(tracer);

            Span span = service.startSpan(TracingService.BATCH_SPAN, Map.of("batch.index", "3"));

            assertNotNull(span);
            verify(tracer).spanBuilder("kg.import.batch");
            verify(builder).setAttribute("batch.index", "3");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Attributes are forwarded to the OpenTelemetry span")
        void attributesForwarded() {
            Span span = new OpenTelemetryTracingService(tracer).startSpan("op");

            span.setAttribute("s", "v");
            span.setAttribute("l", 7L);
            span.setAttribute("d", 0.25);

            verify(otelSpan).setAttribute("s", "v");
            verify(otelSpan).setAttribute("l", 7L);
            verify(otelSpan).setAttribute("d", 0.25);
        }

        @Test
        @DisplayName("Failing a span sets error status and records the exception")
        void failSetsErrorStatus() {
            Span span = new OpenTelemetryTracingService(tracer).startSpan("op");
            IllegalStateException error = new IllegalStateException("store down");

            span.fail(error);

            verify(otelSpan).setStatus(StatusCode.ERROR, "store down");
            verify(otelSpan).recordException(error);
        }

        @Test
        @DisplayName("Closing ends the span")
        void closeEndsSpan() {
            Span span = new OpenTelemetryTracingService(tracer).startSpan("op");

            span.close();

            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Tracer is obtained under the instrumentation name")
        void tracerFromOpenTelemetry() {
            OpenTelemetry openTelemetry = mock(OpenTelemetry.class);
            when(openTelemetry.getTracer(OpenTelemetryTracingService.INSTRUMENTATION_NAME)).thenReturn(tracer);

            new OpenTelemetryTracingService(openTelemetry).startSpan("op").close();

            verify(openTelemetry).getTracer("knowledge-graph-import");
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("The no-op OpenTelemetry instance is usable")
        void noopOpenTelemetry() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(OpenTelemetry.noop());

            assertDoesNotThrow(() -> {
                try (Span span = service.startSpan(TracingService.RESOLVE_SPAN, Map.of("candidate.type", "Person"))) {
                    span.setAttribute("resolve.strategy", "new");
                }
            });
        }
    }
}
