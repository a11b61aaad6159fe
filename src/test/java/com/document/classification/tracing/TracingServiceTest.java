package com.document.classification.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        private final NoOpTracingService service = new NoOpTracingService();

        @Test
        @DisplayName("spans should be callable and closeable")
        void testNoOpSpan() {
            try (Span span = service.startStage(TracingService.SPAN_RULES, "a.txt")) {
                span.setAttribute("category", "Invoices");
                span.setAttribute("rules", 3L);
                span.setStatus(Span.SpanStatus.OK);
                span.recordException(new RuntimeException("ignored"));
            }
        }

        @Test
        @DisplayName("fail should be harmless")
        void testNoOpFail() {
            assertDoesNotThrow(() -> service.startSpan("op").fail(new RuntimeException("ignored")));
        }

        @Test
        @DisplayName("spans should be shared")
        void testSharedSpan() {
            assertSame(service.startSpan("a"), service.startSpan("b", Map.of("k", "v")));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    @ExtendWith(MockitoExtension.class)
    class OpenTelemetryTests {

        @Mock
        private Tracer mockTracer;

        @Mock
        private SpanBuilder mockBuilder;

        @Mock
        private io.opentelemetry.api.trace.Span mockOtelSpan;

        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);
            service = new OpenTelemetryTracingService(mockTracer);
        }

        @Test
        @DisplayName("close should end the span")
        void testCloseEndsSpan() {
            Span span = service.startSpan(TracingService.SPAN_DOCUMENT);
            span.close();

            verify(mockTracer).spanBuilder(TracingService.SPAN_DOCUMENT);
            verify(mockOtelSpan).end();
        }

        @Test
        @DisplayName("attributes passed at start should go to the builder")
        void testStartAttributes() {
            service.startSpan("op", Map.of("category", "Invoices")).close();

            verify(mockBuilder).setAttribute("category", "Invoices");
        }

        @Test
        @DisplayName("stage spans should carry the document path")
        void testStageSpan() {
            when(mockBuilder.setSpanKind(any())).thenReturn(mockBuilder);
            when(mockBuilder.setAttribute(eq(AttributeKey.stringKey("document.path")), eq("inbox/a.pdf")))
                    .thenReturn(mockBuilder);

            service.startStage(TracingService.SPAN_SEMANTIC, "inbox/a.pdf").close();

            verify(mockTracer).spanBuilder(TracingService.SPAN_SEMANTIC);
            verify(mockBuilder).setSpanKind(SpanKind.INTERNAL);
            verify(mockOtelSpan).end();
        }

        @Test
        @DisplayName("status should map to OpenTelemetry status codes")
        void testStatusMapping() {
            Span ok = service.startSpan("ok");
            ok.setStatus(Span.SpanStatus.OK);
            Span error = service.startSpan("error");
            error.setStatus(Span.SpanStatus.ERROR);

            verify(mockOtelSpan).setStatus(StatusCode.OK);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("attributes and exceptions should be forwarded")
        void testForwarding() {
            RuntimeException failure = new RuntimeException("boom");
            try (Span span = service.startSpan("op")) {
                span.setAttribute("category", "Contracts");
                span.setAttribute("rules", 2L);
                span.setAttribute("ignored", null);
                span.recordException(failure);
            }

            verify(mockOtelSpan).setAttribute("category", "Contracts");
            verify(mockOtelSpan).setAttribute("rules", 2L);
            verify(mockOtelSpan, never()).setAttribute(eq("ignored"), anyString());
            verify(mockOtelSpan).recordException(failure);
        }

        @Test
        @DisplayName("fail should record the exception and mark the span as errored")
        void testFail() {
            IllegalStateException failure = new IllegalStateException("extract failed");
            try (Span span = service.startSpan(TracingService.SPAN_EXTRACT)) {
                span.fail(failure);
            }

            verify(mockOtelSpan).recordException(failure);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR);
            verify(mockOtelSpan).end();
        }

        @Test
        @DisplayName("OpenTelemetry constructor should use the instrumentation name")
        void testInstrumentationName() {
            OpenTelemetry openTelemetry = mock(OpenTelemetry.class);
            when(openTelemetry.getTracer(OpenTelemetryTracingService.INSTRUMENTATION_NAME)).thenReturn(mockTracer);

            new OpenTelemetryTracingService(openTelemetry).startSpan("op").close();

            verify(mockOtelSpan).end();
        }
    }
}
