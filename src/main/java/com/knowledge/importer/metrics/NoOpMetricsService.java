package com.knowledge.importer.metrics;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordImportDuration(Duration duration, boolean dryRun) {
    }

    @Override
    public void incrementNodeOutcome(String type, String outcome) {
    }

    @Override
    public void incrementRelationshipOutcome(String outcome) {
    }

    @Override
    public void recordMatchConfidence(double confidence) {
    }

    @Override
    public void incrementMatchDecision(String action) {
    }

    @Override
    public void incrementEmbeddingFailure() {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
