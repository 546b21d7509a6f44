package com.knowledge.importer.review;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A deferred match decision: the stored node, the candidate that might be the same entity,
 * and the confidence that put the pair in the review band.
 */
public class ReviewItem {

    private final String id;
    private final String entityType;
    private final String existingNodeId;
    private final Map<String, Object> existingProperties;
    private final Map<String, Object> candidateProperties;
    private final double confidenceScore;
    private final List<String> matchedMethods;
    private final String reason;
    private final Instant createdAt;
    private ReviewStatus status;
    private ReviewAction action;
    private Instant reviewedAt;
    private String reviewerId;
    private String targetNodeId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.entityType = Objects.requireNonNull(builder.entityType, "entityType is required");
        this.existingNodeId = Objects.requireNonNull(builder.existingNodeId, "existingNodeId is required");
        this.existingProperties = copy(builder.existingProperties);
        this.candidateProperties = copy(builder.candidateProperties);
        this.confidenceScore = builder.confidenceScore;
        this.matchedMethods = builder.matchedMethods != null ? List.copyOf(builder.matchedMethods) : List.of();
        this.reason = builder.reason;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.action = builder.action;
        this.reviewedAt = builder.reviewedAt;
        this.reviewerId = builder.reviewerId;
        this.targetNodeId = builder.targetNodeId;
        this.notes = builder.notes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getExistingNodeId() {
        return existingNodeId;
    }

    public Map<String, Object> getExistingProperties() {
        return existingProperties;
    }

    public Map<String, Object> getCandidateProperties() {
        return candidateProperties;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public List<String> getMatchedMethods() {
        return matchedMethods;
    }

    public String getReason() {
        return reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public synchronized ReviewAction getAction() {
        return action;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getTargetNodeId() {
        return targetNodeId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public synchronized boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void markResolved(ReviewAction action, String reviewerId, String targetNodeId,
                                   String notes, Instant reviewedAt) {
        this.status = action.resultingStatus();
        this.action = action;
        this.reviewerId = reviewerId;
        this.targetNodeId = targetNodeId;
        this.notes = notes;
        this.reviewedAt = reviewedAt;
    }

    private static Map<String, Object> copy(Map<String, Object> properties) {
        // values may be null, so Map.copyOf is not an option
        return properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((ReviewItem) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ReviewItem{id='" + id + "', entityType='" + entityType + "', existingNodeId='" + existingNodeId
                + "', score=" + confidenceScore + ", status=" + getStatus() + '}';
    }

    public static class Builder {
        private String id;
        private String entityType;
        private String existingNodeId;
        private Map<String, Object> existingProperties;
        private Map<String, Object> candidateProperties;
        private double confidenceScore;
        private List<String> matchedMethods;
        private String reason;
        private Instant createdAt;
        private ReviewStatus status;
        private ReviewAction action;
        private Instant reviewedAt;
        private String reviewerId;
        private String targetNodeId;
        private String notes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder existingNodeId(String existingNodeId) {
            this.existingNodeId = existingNodeId;
            return this;
        }

        public Builder existingProperties(Map<String, Object> properties) {
            this.existingProperties = properties;
            return this;
        }

        public Builder candidateProperties(Map<String, Object> properties) {
            this.candidateProperties = properties;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder matchedMethods(List<String> matchedMethods) {
            this.matchedMethods = matchedMethods;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder action(ReviewAction action) {
            this.action = action;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder reviewerId(String reviewerId) {
            this.reviewerId = reviewerId;
            return this;
        }

        public Builder targetNodeId(String targetNodeId) {
            this.targetNodeId = targetNodeId;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
