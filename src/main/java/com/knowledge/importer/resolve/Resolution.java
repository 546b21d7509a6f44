package com.knowledge.importer.resolve;

import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.review.ReviewItem;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of resolving one candidate, together with the review records the resolution
 * produced. Persisting those records is left to the caller.
 *
 * @param node           the stored node the candidate resolved to, if any
 * @param strategy       name of the strategy that resolved it, {@code null} when new
 * @param pendingReviews review records to persist
 * @param embedding      the candidate's embedding if one was read or derived, else {@code null}
 */
public record Resolution(Optional<GraphNode> node, String strategy, List<ReviewItem> pendingReviews,
                         float[] embedding) {

    public Resolution {
        node = node != null ? node : Optional.empty();
        pendingReviews = pendingReviews != null ? List.copyOf(pendingReviews) : List.of();
    }

    public boolean isExisting() {
        return node.isPresent();
    }

    public boolean isNew() {
        return node.isEmpty();
    }
}
