package com.knowledge.importer.review;

/**
 * Lifecycle of a review record. Only a reviewer action moves a record out of {@code PENDING}.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
