package com.knowledge.importer.review;

import com.knowledge.importer.api.Page;
import com.knowledge.importer.api.PageRequest;

/**
 * Persistent queue of deferred match decisions awaiting a reviewer.
 * Records are never deleted; resolving one only changes its status.
 */
public interface ReviewQueue {

    /**
     * Stores a new pending record.
     *
     * @param item the record to store
     * @return the stored record
     */
    ReviewItem submit(ReviewItem item);

    /**
     * @param reviewId the record id
     * @return the record, or {@code null} if there is none
     */
    ReviewItem get(String reviewId);

    /**
     * Pending records, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    /**
     * Pending records of one entity type, oldest first.
     */
    Page<ReviewItem> getPendingByEntityType(String entityType, PageRequest page);

    /**
     * Pending records whose confidence lies in {@code [minScore, maxScore]}, highest first.
     */
    Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page);

    /**
     * Moves a pending record to its resolved status.
     *
     * @param reviewId     the record id
     * @param action       the reviewer's decision
     * @param reviewerId   who decided
     * @param targetNodeId node the candidate was folded into, if any
     * @param notes        optional reviewer notes
     * @return the resolved record
     * @throws IllegalArgumentException if the record does not exist
     * @throws IllegalStateException    if the record is not pending
     */
    ReviewItem resolve(String reviewId, ReviewAction action, String reviewerId, String targetNodeId, String notes);

    long countPending();
}
