package com.document.classification.tracing;

import java.util.Map;

/**
 * Default {@link TracingService}: every stage gets the same inert span.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return InertSpan.INSTANCE;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    @Override
    public Span startStage(String stage, String document) {
        return InertSpan.INSTANCE;
    }

    private enum InertSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
            // ignored
        }

        @Override
        public void setAttribute(String key, long value) {
            // ignored
        }

        @Override
        public void setStatus(SpanStatus status) {
            // ignored
        }

        @Override
        public void recordException(Throwable t) {
            // ignored
        }

        @Override
        public void close() {
            // nothing to end
        }
    }
}
