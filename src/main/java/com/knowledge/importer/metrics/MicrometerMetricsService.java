package com.knowledge.importer.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsService} on a Micrometer {@link MeterRegistry}.
 *
 * <ul>
 *   <li>{@code kg.import.duration} timer (tag: dryRun)</li>
 *   <li>{@code kg.node.outcome} counter (tags: type, outcome)</li>
 *   <li>{@code kg.relationship.outcome} counter (tag: outcome)</li>
 *   <li>{@code kg.match.confidence} summary</li>
 *   <li>{@code kg.match.decision} counter (tag: action)</li>
 *   <li>{@code kg.embedding.failure} counter</li>
 *   <li>{@code kg.import.batch.size} summary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<Boolean, Timer> importTimers = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter embeddingFailures;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("kg.match.confidence")
                .description("Confidence of scored candidate pairs")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("kg.import.batch.size")
                .description("Candidates per import batch")
                .register(registry);
        this.embeddingFailures = Counter.builder("kg.embedding.failure")
                .description("Embedding requests that produced no vector")
                .register(registry);
    }

    @Override
    public void recordImportDuration(Duration duration, boolean dryRun) {
        importTimers.computeIfAbsent(dryRun, flag ->
                Timer.builder("kg.import.duration")
                        .description("Wall-clock duration of import runs")
                        .tag("dryRun", String.valueOf(flag))
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementNodeOutcome(String type, String outcome) {
        String safeType = type != null ? type : "unknown";
        counters.computeIfAbsent("node:" + safeType + ":" + outcome, key ->
                Counter.builder("kg.node.outcome")
                        .description("Candidate nodes by outcome")
                        .tag("type", safeType)
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementRelationshipOutcome(String outcome) {
        counters.computeIfAbsent("relationship:" + outcome, key ->
                Counter.builder("kg.relationship.outcome")
                        .description("Candidate relationships by outcome")
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordMatchConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementMatchDecision(String action) {
        counters.computeIfAbsent("decision:" + action, key ->
                Counter.builder("kg.match.decision")
                        .description("Match decisions by action")
                        .tag("action", action)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementEmbeddingFailure() {
        embeddingFailures.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
