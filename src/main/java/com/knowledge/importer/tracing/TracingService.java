package com.knowledge.importer.tracing;

import java.util.Map;

/**
 * Starts spans around import runs, batches and candidate resolution.
 * {@link NoOpTracingService} is used unless a tracer is configured.
 */
public interface TracingService {

    String IMPORT_SPAN = "kg.import";
    String BATCH_SPAN = "kg.import.batch";
    String RESOLVE_SPAN = "kg.resolve";

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    Span startSpan(String operationName, Map<String, String> attributes);
}
