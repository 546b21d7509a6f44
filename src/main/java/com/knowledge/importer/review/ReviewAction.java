package com.knowledge.importer.review;

/**
 * What an external reviewer decided about a deferred match.
 */
public enum ReviewAction {
    /** Same entity: fold the candidate into the existing node. */
    APPROVE,
    /** Different entities: leave the graph untouched. */
    REJECT,
    /** Same entity as another node chosen by the reviewer. */
    MERGE;

    public ReviewStatus resultingStatus() {
        return this == REJECT ? ReviewStatus.REJECTED : ReviewStatus.APPROVED;
    }
}
