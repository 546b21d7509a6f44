package com.knowledge.importer.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes review records off the resolution path. {@link #submit} returns immediately;
 * a failed write is logged and dropped.
 */
public class ReviewSubmitter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReviewSubmitter.class);

    private final ReviewQueue queue;
    private final ExecutorService executor;
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();

    public ReviewSubmitter(ReviewQueue queue) {
        this(queue, Executors.newSingleThreadExecutor(daemonThreads()));
    }

    public ReviewSubmitter(ReviewQueue queue, ExecutorService executor) {
        this.queue = queue;
        this.executor = executor;
    }

    public ReviewQueue queue() {
        return queue;
    }

    public void submit(ReviewItem item) {
        CompletableFuture<Void> write = CompletableFuture.runAsync(() -> {
            queue.submit(item);
            log.info("review.queued reviewId={} entityType={} existingNodeId={} score={}",
                    item.getId(), item.getEntityType(), item.getExistingNodeId(), item.getConfidenceScore());
        }, executor);
        inFlight.add(write);
        write.whenComplete((ignored, error) -> {
            inFlight.remove(write);
            if (error != null) {
                log.error("review.submit_failed reviewId={} error={}", item.getId(), error.getMessage(), error);
            }
        });
    }

    /**
     * Waits up to {@code timeout} for the writes submitted so far.
     *
     * @return true if every write finished in time
     */
    public boolean awaitSubmitted(Duration timeout) {
        CompletableFuture<?>[] pending = inFlight.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            // individual failures are already logged
            return true;
        } catch (TimeoutException e) {
            log.warn("review.flush_timeout pending={}", inFlight.size());
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "review-submitter-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
