package com.document.classification.tracing;

/**
 * One traced pipeline stage, ended when closed.
 *
 * <pre>
 * try (Span span = tracingService.startStage(TracingService.SPAN_RULES, path.toString())) {
 *     span.setAttribute("category", best);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the exception and marks the stage as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    /**
     * Ends the span. Never throws.
     */
    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
