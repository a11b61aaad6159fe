package com.document.classification.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Bridges pipeline spans to an OpenTelemetry {@link Tracer}.
 *
 * <p>Stage spans are {@link SpanKind#INTERNAL} and carry the document path
 * under {@code document.path}. A span started on a worker thread becomes a child
 * of whatever context is current on that thread.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_NAME = "document-classification";

    static final AttributeKey<String> DOCUMENT_PATH = AttributeKey.stringKey("document.path");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Uses the tracer registered under {@link #INSTRUMENTATION_NAME}.
     */
    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String operationName) {
        return new StageSpan(tracer.spanBuilder(operationName).startSpan());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                builder.setAttribute(attribute.getKey(), attribute.getValue());
            }
        }
        return new StageSpan(builder.startSpan());
    }

    @Override
    public Span startStage(String stage, String document) {
        io.opentelemetry.api.trace.Span span = tracer.spanBuilder(stage)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(DOCUMENT_PATH, document)
                .startSpan();
        return new StageSpan(span);
    }

    private static final class StageSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        StageSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            if (value != null) {
                delegate.setAttribute(key, value);
            }
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            if (status == SpanStatus.ERROR) {
                delegate.setStatus(StatusCode.ERROR);
            } else {
                delegate.setStatus(StatusCode.OK);
            }
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
