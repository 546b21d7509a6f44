package com.knowledge.importer.tracing;

/**
 * One traced unit of import work; closing it ends the span.
 *
 * <pre>
 * try (Span span = tracing.startSpan("kg.import.batch")) {
 *     span.setAttribute("batch.size", candidates.size());
 *     ...
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    /**
     * Marks the span failed and attaches the exception.
     */
    void fail(Throwable error);

    @Override
    void close();
}
