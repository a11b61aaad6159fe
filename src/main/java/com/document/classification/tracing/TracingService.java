package com.document.classification.tracing;

import java.util.Map;

/**
 * Tracing hook for the classification pipeline.
 * {@link NoOpTracingService} is the default; {@link OpenTelemetryTracingService}
 * bridges to an OpenTelemetry tracer.
 */
public interface TracingService {

    String SPAN_DOCUMENT = "document.classify";
    String SPAN_EXTRACT = "document.extract";
    String SPAN_RULES = "document.rules";
    String SPAN_SEMANTIC = "document.semantic";
    String SPAN_RESOLVE = "document.resolve";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts a span for a pipeline stage of one document.
     */
    default Span startStage(String stage, String document) {
        return startSpan(stage, Map.of("document", document));
    }
}
