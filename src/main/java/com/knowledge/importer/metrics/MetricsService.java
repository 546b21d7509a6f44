package com.knowledge.importer.metrics;

import java.time.Duration;

/**
 * Import pipeline measurements. {@link NoOpMetricsService} is used unless a registry is configured.
 */
public interface MetricsService {

    /** Outcome tag values for node and relationship counters. */
    String CREATED = "created";
    String UPDATED = "updated";
    String SKIPPED = "skipped";
    String DUPLICATE = "duplicate";
    String ERROR = "error";

    void recordImportDuration(Duration duration, boolean dryRun);

    void incrementNodeOutcome(String type, String outcome);

    void incrementRelationshipOutcome(String outcome);

    void recordMatchConfidence(double confidence);

    void incrementMatchDecision(String action);

    void incrementEmbeddingFailure();

    void recordBatchSize(int size);
}
