package com.knowledge.importer.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * MDC entries scoped to a try-with-resources block. Import runs, candidates and review
 * actions each open one, so every log line carries the run id and the entity it concerns.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCandidate("Person", "Jon Smith")) {
 *     log.info("node.created nodeId={}", nodeId);
 * }
 * </pre>
 *
 * <p>Entries put by an inner context that shadow an outer one are restored on close.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previous = new HashMap<>();

    private LogContext() {
    }

    public static LogContext forImport(String importId) {
        return new LogContext()
                .with("importId", importId)
                .with("operation", "import");
    }

    public static LogContext forCandidate(String candidateType, String candidateName) {
        return new LogContext()
                .with("candidateType", candidateType)
                .with("candidateName", candidateName);
    }

    public static LogContext forReview(String reviewId, String action) {
        return new LogContext()
                .with("reviewId", reviewId)
                .with("operation", "review")
                .with("reviewAction", action);
    }

    public static String newImportId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Wraps a task so it runs with the caller's current MDC entries on whatever thread executes it.
     */
    public static Runnable propagating(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> saved = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                task.run();
            } finally {
                if (saved != null) {
                    MDC.setContextMap(saved);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    /**
     * Adds an entry; null values are skipped.
     */
    public LogContext with(String key, String value) {
        if (value == null) {
            return this;
        }
        String existing = MDC.get(key);
        if (existing != null && !keys.contains(key)) {
            previous.put(key, existing);
        }
        keys.add(key);
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        for (String key : keys) {
            String restored = previous.get(key);
            if (restored != null) {
                MDC.put(key, restored);
            } else {
                MDC.remove(key);
            }
        }
        keys.clear();
        previous.clear();
    }
}
