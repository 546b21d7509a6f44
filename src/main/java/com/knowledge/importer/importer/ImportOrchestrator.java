package com.knowledge.importer.importer;

import com.knowledge.importer.embedding.EmbeddingGateway;
import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.GraphStoreUnavailableException;
import com.knowledge.importer.logging.LogContext;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.CandidateRelationship;
import com.knowledge.importer.model.ImportRequest;
import com.knowledge.importer.normalize.PropertyNormalizer;
import com.knowledge.importer.resolve.NodeResolver;
import com.knowledge.importer.review.ConfidenceScorer;
import com.knowledge.importer.review.ReviewSubmitter;
import com.knowledge.importer.tracing.Span;
import com.knowledge.importer.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Runs a whole import: every node candidate first, so relationship endpoints can be found,
 * then every relationship candidate.
 *
 * <p>Candidates are processed in batches of {@link ImportOptions#getBatchSize()} on a pool of
 * {@link ImportOptions#getConcurrency()} workers. Candidates sharing an identity key are handed to
 * one worker and imported in order, so two copies of the same entity never race to create it.
 * A group's time budget starts when a worker picks it up. A failing or timed-out candidate is
 * counted as an error and the run continues; every candidate lands in exactly one outcome.</p>
 */
public class ImportOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ImportOrchestrator.class);

    private static final Duration REVIEW_FLUSH_TIMEOUT = Duration.ofSeconds(10);

    private final GraphStore graphStore;
    private final EmbeddingGateway embeddingGateway;
    private final NodeMatcherRegistry registry;
    private final PropertyNormalizer normalizer;
    private final ReviewSubmitter reviewSubmitter;
    private final MetricsService metrics;
    private final TracingService tracing;

    public ImportOrchestrator(GraphStore graphStore, EmbeddingGateway embeddingGateway,
                              NodeMatcherRegistry registry, PropertyNormalizer normalizer,
                              ReviewSubmitter reviewSubmitter, MetricsService metrics, TracingService tracing) {
        this.graphStore = graphStore;
        this.embeddingGateway = embeddingGateway;
        this.registry = registry;
        this.normalizer = normalizer;
        this.reviewSubmitter = reviewSubmitter;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    public ImportStatistics run(ImportRequest request, ImportOptions options) {
        return run(request, options, new ImportCancellation());
    }

    /**
     * @throws GraphStoreUnavailableException if the store cannot be reached before the run starts
     */
    public ImportStatistics run(ImportRequest request, ImportOptions options, ImportCancellation cancellation) {
        if (!graphStore.isAvailable()) {
            throw new GraphStoreUnavailableException("Graph store is not reachable; import not started");
        }
        String importId = LogContext.newImportId();
        ImportStatistics stats = new ImportStatistics(importId, options.isDryRun());

        try (LogContext ignored = LogContext.forImport(importId);
             Span span = tracing.startSpan(TracingService.IMPORT_SPAN, Map.of(
                     "import.id", importId,
                     "import.dry_run", String.valueOf(options.isDryRun())))) {
            log.info("import.started entities={} relationships={} options={}",
                    request.entities().size(), request.relationships().size(), options);
            stats.start();

            ExecutorService workers = newWorkerPool(options.getConcurrency());
            try {
                NodeImporter nodeImporter = new NodeImporter(graphStore, resolverFor(options), registry,
                        normalizer, reviewSubmitter, metrics);
                RelationshipImporter relationshipImporter = new RelationshipImporter(graphStore, normalizer, metrics);

                runPhase("nodes", request.entities(), CandidateNode::identityKey,
                        (candidate, outcome) -> nodeImporter.importNode(candidate, options, outcome),
                        (candidate, reason) -> {
                            stats.nodeSeen();
                            stats.nodeFailed(candidate.type(), candidate.describe(), reason);
                        },
                        options, cancellation, stats, workers);
                runPhase("relationships", request.relationships(), CandidateRelationship::identityKey,
                        (candidate, outcome) -> relationshipImporter.importRelationship(candidate, options, outcome),
                        (candidate, reason) -> {
                            stats.relationshipSeen();
                            stats.relationshipFailed(candidate.normalizedType(), candidate.describe(), reason);
                        },
                        options, cancellation, stats, workers);
            } finally {
                shutdown(workers);
            }

            if (!options.isDryRun() && !reviewSubmitter.awaitSubmitted(REVIEW_FLUSH_TIMEOUT)) {
                log.warn("import.reviews_pending timeoutMs={}", REVIEW_FLUSH_TIMEOUT.toMillis());
            }
            stats.finish();
            metrics.recordImportDuration(stats.getDuration(), options.isDryRun());
            span.setAttribute("import.nodes.created", stats.getNodesCreated());
            span.setAttribute("import.errors", stats.getNodesErrors() + stats.getRelationshipsErrors());
            log.info("import.completed cancelled={} durationMs={}\n{}",
                    stats.isCancelled(), stats.getDuration().toMillis(), stats.summary());
            return stats;
        }
    }

    NodeResolver resolverFor(ImportOptions options) {
        ConfidenceScorer scorer = new ConfidenceScorer(registry, options.getConfidenceModifiers(),
                options.getDecisionThresholds());
        return NodeResolver.standard(graphStore, embeddingGateway, registry, scorer, metrics, tracing);
    }

    // ========== Batching ==========

    private <T> void runPhase(String phase, List<T> candidates, Function<T, String> identityKey,
                              BiConsumer<T, ImportStatistics> importer, BiConsumer<T, String> onFailure,
                              ImportOptions options, ImportCancellation cancellation, ImportStatistics stats,
                              ExecutorService workers) {
        int total = candidates.size();
        int batchSize = options.getBatchSize();
        for (int from = 0; from < total; from += batchSize) {
            if (cancellation.isCancelled()) {
                stats.markCancelled();
                log.warn("import.cancelled phase={} processed={} total={}", phase, from, total);
                return;
            }
            List<T> batch = candidates.subList(from, Math.min(from + batchSize, total));
            try (Span span = tracing.startSpan(TracingService.BATCH_SPAN, Map.of("batch.phase", phase))) {
                span.setAttribute("batch.size", batch.size());
                metrics.recordBatchSize(batch.size());
                runBatch(batch, identityKey, importer, onFailure, options, cancellation, stats, workers);
            }
            options.getProgressCallback().onProgress(phase, from + batch.size(), total);
            log.debug("import.batch_done phase={} processed={} total={}", phase, from + batch.size(), total);
        }
    }

    private <T> void runBatch(List<T> batch, Function<T, String> identityKey,
                              BiConsumer<T, ImportStatistics> importer, BiConsumer<T, String> onFailure,
                              ImportOptions options, ImportCancellation cancellation, ImportStatistics stats,
                              ExecutorService workers) {
        Map<String, List<T>> groups = new LinkedHashMap<>();
        for (T candidate : batch) {
            groups.computeIfAbsent(identityKey.apply(candidate), key -> new ArrayList<>()).add(candidate);
        }

        List<GroupRun<T>> runs = new ArrayList<>();
        for (List<T> group : groups.values()) {
            if (cancellation.isCancelled()) {
                stats.markCancelled();
                break;
            }
            GroupRun<T> run = new GroupRun<>(group);
            run.future = workers.submit(LogContext.propagating(() -> run.execute(importer, onFailure, stats)));
            runs.add(run);
        }

        long timeoutPerCandidate = options.getCandidateTimeout().toNanos();
        for (GroupRun<T> run : runs) {
            await(run, timeoutPerCandidate * run.size(), onFailure);
        }
    }

    /**
     * Waits for a group, counting from the moment a worker picked it up. Whatever is still
     * unsettled when the time is up is counted as failed.
     */
    private static <T> void await(GroupRun<T> run, long timeoutNanos, BiConsumer<T, String> onFailure) {
        try {
            run.awaitStart();
            long remaining = timeoutNanos - (System.nanoTime() - run.startedAtNanos);
            run.future.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            run.future.cancel(true);
            int timedOut = run.settleRemaining(onFailure, "timed out");
            log.error("import.candidate_timeout candidates={} timedOut={}", run.size(), timedOut);
        } catch (ExecutionException e) {
            int failed = run.settleRemaining(onFailure, String.valueOf(e.getCause()));
            log.error("import.worker_failed failed={} error={}", failed, String.valueOf(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.future.cancel(true);
            run.settleRemaining(onFailure, "interrupted");
        }
    }

    /**
     * Candidates sharing an identity key, imported in order by one worker. Each candidate's
     * outcome is settled exactly once: by the worker when it finishes, or by the waiting
     * thread when the group runs out of time. The loser of that race counts nothing.
     */
    private static final class GroupRun<T> {
        private final List<T> candidates;
        private final AtomicBoolean[] settled;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedAtNanos;
        private Future<?> future;

        GroupRun(List<T> candidates) {
            this.candidates = candidates;
            this.settled = new AtomicBoolean[candidates.size()];
            for (int i = 0; i < settled.length; i++) {
                settled[i] = new AtomicBoolean();
            }
        }

        int size() {
            return candidates.size();
        }

        void awaitStart() throws InterruptedException {
            started.await();
        }

        void execute(BiConsumer<T, ImportStatistics> importer, BiConsumer<T, String> onFailure,
                     ImportStatistics stats) {
            startedAtNanos = System.nanoTime();
            started.countDown();
            for (int i = 0; i < candidates.size(); i++) {
                if (settled[i].get()) {
                    continue;
                }
                T candidate = candidates.get(i);
                ImportStatistics outcome = stats.forCandidate();
                try {
                    importer.accept(candidate, outcome);
                    if (settled[i].compareAndSet(false, true)) {
                        stats.add(outcome);
                    } else {
                        log.warn("import.late_completion candidate={}", candidate);
                    }
                } catch (RuntimeException e) {
                    log.error("import.candidate_failed error={}", e.getMessage(), e);
                    if (settled[i].compareAndSet(false, true)) {
                        onFailure.accept(candidate, e.getMessage());
                    }
                }
            }
        }

        int settleRemaining(BiConsumer<T, String> onFailure, String reason) {
            int count = 0;
            for (int i = 0; i < candidates.size(); i++) {
                if (settled[i].compareAndSet(false, true)) {
                    onFailure.accept(candidates.get(i), reason);
                    count++;
                }
            }
            return count;
        }
    }

    // ========== Worker pool ==========

    private static ExecutorService newWorkerPool(int concurrency) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "kg-import-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(concurrency, factory);
    }

    private static void shutdown(ExecutorService workers) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
