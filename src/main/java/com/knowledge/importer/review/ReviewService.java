package com.knowledge.importer.review;

import com.knowledge.importer.api.Page;
import com.knowledge.importer.api.PageRequest;
import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.logging.LogContext;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.model.PropertyValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The review surface: lists deferred decisions and applies reviewer actions to the graph.
 *
 * <p>Approve folds the candidate properties into the stored node (or into another node the
 * reviewer points at), merge folds them into the given target node, reject changes nothing.
 * Actions are idempotent: a record that is already resolved is returned as it was resolved.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue queue;
    private final GraphStore graphStore;

    public ReviewService(ReviewQueue queue, GraphStore graphStore) {
        this.queue = queue;
        this.graphStore = graphStore;
    }

    // ========== Listing ==========

    public ReviewItem get(String reviewId) {
        return queue.get(reviewId);
    }

    public Page<ReviewItem> pending(PageRequest page) {
        return queue.getPending(page);
    }

    public Page<ReviewItem> pendingByEntityType(String entityType, PageRequest page) {
        return queue.getPendingByEntityType(entityType, page);
    }

    public Page<ReviewItem> pendingByScoreRange(double minScore, double maxScore, PageRequest page) {
        if (minScore > maxScore) {
            throw new IllegalArgumentException("minScore must not exceed maxScore");
        }
        return queue.getPendingByScoreRange(minScore, maxScore, page);
    }

    public long countPending() {
        return queue.countPending();
    }

    // ========== Actions ==========

    public ReviewOutcome approve(String reviewId, String reviewerId, String notes) {
        return apply(reviewId, ReviewAction.APPROVE, null, reviewerId, notes);
    }

    /**
     * Approves the match but folds the candidate into {@code existingNodeId} rather than
     * the node the record was raised against.
     */
    public ReviewOutcome approve(String reviewId, String existingNodeId, String reviewerId, String notes) {
        return apply(reviewId, ReviewAction.APPROVE, existingNodeId, reviewerId, notes);
    }

    public ReviewOutcome reject(String reviewId, String reviewerId, String notes) {
        return apply(reviewId, ReviewAction.REJECT, null, reviewerId, notes);
    }

    public ReviewOutcome merge(String reviewId, String targetNodeId, String reviewerId, String notes) {
        if (targetNodeId == null || targetNodeId.isBlank()) {
            throw new IllegalArgumentException("merge requires a target node id");
        }
        return apply(reviewId, ReviewAction.MERGE, targetNodeId, reviewerId, notes);
    }

    /**
     * Applies a reviewer action.
     *
     * @throws IllegalArgumentException if the record or the target node does not exist
     */
    public synchronized ReviewOutcome apply(String reviewId, ReviewAction action, String targetNodeId,
                                            String reviewerId, String notes) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        ReviewItem item = queue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        try (LogContext ignored = LogContext.forReview(reviewId, action.name())) {
            if (!item.isPending()) {
                log.info("review.already_resolved status={} action={}", item.getStatus(), item.getAction());
                return ReviewOutcome.of(item);
            }
            String target = null;
            if (action != ReviewAction.REJECT) {
                target = targetNodeId != null ? targetNodeId : item.getExistingNodeId();
                foldInto(target, item.getCandidateProperties());
            }
            ReviewItem resolved = queue.resolve(reviewId, action, reviewerId, target, notes);
            log.info("review.resolved status={} targetNodeId={} reviewerId={}",
                    resolved.getStatus(), target, reviewerId);
            return ReviewOutcome.of(resolved);
        }
    }

    private void foldInto(String nodeId, Map<String, Object> candidateProperties) {
        GraphNode node = graphStore.findByNodeId(nodeId)
                .orElseThrow(() -> new IllegalArgumentException("Target node not found: " + nodeId));
        Map<String, Object> changes = PropertyValues.changes(node.properties(), candidateProperties);
        if (changes.isEmpty()) {
            log.debug("review.no_changes nodeId={}", nodeId);
            return;
        }
        graphStore.updateNode(nodeId, changes);
        log.debug("review.applied nodeId={} properties={}", nodeId, changes.keySet());
    }
}
