package com.knowledge.importer.review;

import com.knowledge.importer.api.Page;
import com.knowledge.importer.api.PageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * {@link ReviewQueue} held in memory, for tests and single-JVM use.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("review.stored reviewId={} entityType={} existingNodeId={} score={}",
                item.getId(), item.getEntityType(), item.getExistingNodeId(), item.getConfidenceScore());
        return item;
    }

    @Override
    public ReviewItem get(String reviewId) {
        return reviewId == null ? null : items.get(reviewId);
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return pending(item -> true, Comparator.comparing(ReviewItem::getCreatedAt), page);
    }

    @Override
    public Page<ReviewItem> getPendingByEntityType(String entityType, PageRequest page) {
        return pending(item -> item.getEntityType().equalsIgnoreCase(entityType),
                Comparator.comparing(ReviewItem::getCreatedAt), page);
    }

    @Override
    public Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page) {
        return pending(item -> item.getConfidenceScore() >= minScore && item.getConfidenceScore() <= maxScore,
                Comparator.comparingDouble(ReviewItem::getConfidenceScore).reversed(), page);
    }

    @Override
    public ReviewItem resolve(String reviewId, ReviewAction action, String reviewerId,
                              String targetNodeId, String notes) {
        ReviewItem item = get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        synchronized (item) {
            if (!item.isPending()) {
                throw new IllegalStateException("Review item is not pending: " + reviewId);
            }
            item.markResolved(action, reviewerId, targetNodeId, notes, Instant.now());
        }
        return item;
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private Page<ReviewItem> pending(Predicate<ReviewItem> filter, Comparator<ReviewItem> order, PageRequest page) {
        List<ReviewItem> matching = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(filter)
                .sorted(order)
                .toList();
        return Page.slice(matching, page);
    }
}
