package com.knowledge.importer.review;

import java.time.Instant;

/**
 * Result of applying a reviewer action. Re-applying an action to a resolved record
 * returns the outcome recorded the first time.
 *
 * @param reviewId      the review record
 * @param action        the action that resolved the record
 * @param status        the record status after the action
 * @param appliedNodeId node that received the candidate properties, {@code null} on reject
 * @param reviewerId    who resolved the record
 * @param reviewedAt    when the record was resolved
 */
public record ReviewOutcome(String reviewId, ReviewAction action, ReviewStatus status,
                            String appliedNodeId, String reviewerId, Instant reviewedAt) {

    static ReviewOutcome of(ReviewItem item) {
        ReviewAction action = item.getAction();
        String applied = action == ReviewAction.REJECT ? null : item.getTargetNodeId();
        return new ReviewOutcome(item.getId(), action, item.getStatus(), applied,
                item.getReviewerId(), item.getReviewedAt());
    }
}
