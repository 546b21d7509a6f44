package com.knowledge.importer.importer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one import run. Workers update them concurrently; every counter is atomic.
 */
public class ImportStatistics {

    private static final String RULE = "=".repeat(80);

    /**
     * A candidate that failed, kept for manual follow-up.
     *
     * @param kind       {@code node} or {@code relationship}
     * @param type       node label or relationship type
     * @param identifier the candidate's identifying fields
     * @param reason     what went wrong
     */
    public record ImportError(String kind, String type, String identifier, String reason) {
    }

    private final AtomicLong nodesTotal = new AtomicLong();
    private final AtomicLong nodesCreated = new AtomicLong();
    private final AtomicLong nodesUpdated = new AtomicLong();
    private final AtomicLong nodesSkipped = new AtomicLong();
    private final AtomicLong nodesDuplicates = new AtomicLong();
    private final AtomicLong nodesErrors = new AtomicLong();

    private final AtomicLong relationshipsTotal = new AtomicLong();
    private final AtomicLong relationshipsCreated = new AtomicLong();
    private final AtomicLong relationshipsSkipped = new AtomicLong();
    private final AtomicLong relationshipsErrors = new AtomicLong();

    private final AtomicLong reviewsQueued = new AtomicLong();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Queue<ImportError> errors = new ConcurrentLinkedQueue<>();

    private final String importId;
    private final boolean dryRun;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public ImportStatistics(String importId, boolean dryRun) {
        this.importId = importId;
        this.dryRun = dryRun;
    }

    // ========== Lifecycle ==========

    void start() {
        startedAt = Instant.now();
    }

    void finish() {
        finishedAt = Instant.now();
    }

    void markCancelled() {
        cancelled.set(true);
    }

    /**
     * Fresh counters for a single candidate, folded into this run with {@link #add} once its
     * outcome is settled.
     */
    ImportStatistics forCandidate() {
        return new ImportStatistics(importId, dryRun);
    }

    void add(ImportStatistics outcome) {
        nodesTotal.addAndGet(outcome.nodesTotal.get());
        nodesCreated.addAndGet(outcome.nodesCreated.get());
        nodesUpdated.addAndGet(outcome.nodesUpdated.get());
        nodesSkipped.addAndGet(outcome.nodesSkipped.get());
        nodesDuplicates.addAndGet(outcome.nodesDuplicates.get());
        nodesErrors.addAndGet(outcome.nodesErrors.get());
        relationshipsTotal.addAndGet(outcome.relationshipsTotal.get());
        relationshipsCreated.addAndGet(outcome.relationshipsCreated.get());
        relationshipsSkipped.addAndGet(outcome.relationshipsSkipped.get());
        relationshipsErrors.addAndGet(outcome.relationshipsErrors.get());
        reviewsQueued.addAndGet(outcome.reviewsQueued.get());
        errors.addAll(outcome.errors);
    }

    // ========== Node counters ==========

    void nodeSeen() {
        nodesTotal.incrementAndGet();
    }

    void nodeCreated() {
        nodesCreated.incrementAndGet();
    }

    void nodeUpdated() {
        nodesUpdated.incrementAndGet();
    }

    void nodeSkipped() {
        nodesSkipped.incrementAndGet();
    }

    void nodeDuplicate() {
        nodesDuplicates.incrementAndGet();
    }

    void nodeFailed(String type, String identifier, String reason) {
        nodesErrors.incrementAndGet();
        errors.add(new ImportError("node", type, identifier, reason));
    }

    // ========== Relationship counters ==========

    void relationshipSeen() {
        relationshipsTotal.incrementAndGet();
    }

    void relationshipCreated() {
        relationshipsCreated.incrementAndGet();
    }

    void relationshipSkipped() {
        relationshipsSkipped.incrementAndGet();
    }

    void relationshipFailed(String type, String identifier, String reason) {
        relationshipsErrors.incrementAndGet();
        errors.add(new ImportError("relationship", type, identifier, reason));
    }

    void reviewQueued() {
        reviewsQueued.incrementAndGet();
    }

    // ========== Accessors ==========

    public String getImportId() {
        return importId;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public long getNodesTotal() {
        return nodesTotal.get();
    }

    public long getNodesCreated() {
        return nodesCreated.get();
    }

    public long getNodesUpdated() {
        return nodesUpdated.get();
    }

    public long getNodesSkipped() {
        return nodesSkipped.get();
    }

    /**
     * Candidates that resolved to a node already in the store.
     */
    public long getNodesDuplicates() {
        return nodesDuplicates.get();
    }

    public long getNodesErrors() {
        return nodesErrors.get();
    }

    public long getRelationshipsTotal() {
        return relationshipsTotal.get();
    }

    public long getRelationshipsCreated() {
        return relationshipsCreated.get();
    }

    public long getRelationshipsSkipped() {
        return relationshipsSkipped.get();
    }

    public long getRelationshipsErrors() {
        return relationshipsErrors.get();
    }

    public long getReviewsQueued() {
        return reviewsQueued.get();
    }

    public List<ImportError> getErrors() {
        return List.copyOf(errors);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * Wall-clock duration of the run; up to now while it is still running.
     */
    public Duration getDuration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt != null ? finishedAt : Instant.now());
    }

    // ========== Summary ==========

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("IMPORT SUMMARY").append(dryRun ? " (DRY RUN)" : "").append(cancelled.get() ? " (CANCELLED)" : "")
                .append('\n');
        sb.append(RULE).append('\n');
        sb.append("NODES:\n");
        line(sb, "Total", nodesTotal.get());
        line(sb, "Created", nodesCreated.get());
        line(sb, "Updated", nodesUpdated.get());
        line(sb, "Skipped", nodesSkipped.get());
        line(sb, "Duplicates", nodesDuplicates.get());
        line(sb, "Errors", nodesErrors.get());
        sb.append("RELATIONSHIPS:\n");
        line(sb, "Total", relationshipsTotal.get());
        line(sb, "Created", relationshipsCreated.get());
        line(sb, "Skipped", relationshipsSkipped.get());
        line(sb, "Errors", relationshipsErrors.get());
        if (reviewsQueued.get() > 0) {
            sb.append("REVIEWS:\n");
            line(sb, "Queued", reviewsQueued.get());
        }
        sb.append("Duration: ").append(formatDuration(getDuration())).append('\n');
        sb.append(RULE);
        return sb.toString();
    }

    /**
     * Milliseconds below one second, otherwise seconds with two decimals.
     */
    static String formatDuration(Duration duration) {
        long millis = duration.toMillis();
        if (millis < 1_000) {
            return millis + "ms";
        }
        return String.format(Locale.ROOT, "%.2fs", millis / 1_000.0);
    }

    private static void line(StringBuilder sb, String label, long value) {
        sb.append(String.format(Locale.ROOT, "  %-11s %d", label + ":", value)).append('\n');
    }

    @Override
    public String toString() {
        return "ImportStatistics{importId=" + importId
                + ", nodes=[total=" + nodesTotal + ", created=" + nodesCreated + ", updated=" + nodesUpdated
                + ", skipped=" + nodesSkipped + ", duplicates=" + nodesDuplicates + ", errors=" + nodesErrors
                + "], relationships=[total=" + relationshipsTotal + ", created=" + relationshipsCreated
                + ", skipped=" + relationshipsSkipped + ", errors=" + relationshipsErrors
                + "], cancelled=" + cancelled + '}';
    }
}
