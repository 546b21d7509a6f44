package com.knowledge.importer.resolve;

import com.knowledge.importer.review.ReviewItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-candidate state shared by the resolution strategies: the normalized candidate, the
 * switches that apply to this run, and the side effects strategies collect along the way.
 */
public final class ResolutionContext {

    private final String type;
    private final Map<String, Object> properties;
    private final Set<String> uniqueProperties;
    private final boolean vectorSearchEnabled;
    private final double vectorThreshold;
    private final boolean humanReviewEnabled;
    private final int fuzzyCandidateLimit;

    private final List<ReviewItem> pendingReviews = new ArrayList<>();
    private float[] embedding;

    private ResolutionContext(Builder builder) {
        if (builder.type == null || builder.type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        this.type = builder.type;
        this.properties = builder.properties != null ? builder.properties : Map.of();
        this.uniqueProperties = builder.uniqueProperties != null ? Set.copyOf(builder.uniqueProperties) : Set.of();
        this.vectorSearchEnabled = builder.vectorSearchEnabled;
        this.vectorThreshold = builder.vectorThreshold;
        this.humanReviewEnabled = builder.humanReviewEnabled;
        this.fuzzyCandidateLimit = builder.fuzzyCandidateLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String type() {
        return type;
    }

    /**
     * The candidate's normalized properties.
     */
    public Map<String, Object> properties() {
        return properties;
    }

    public Set<String> uniqueProperties() {
        return uniqueProperties;
    }

    public boolean vectorSearchEnabled() {
        return vectorSearchEnabled;
    }

    public double vectorThreshold() {
        return vectorThreshold;
    }

    public boolean humanReviewEnabled() {
        return humanReviewEnabled;
    }

    public int fuzzyCandidateLimit() {
        return fuzzyCandidateLimit;
    }

    /**
     * The candidate's embedding, once a strategy has read or derived it.
     */
    public float[] embedding() {
        return embedding;
    }

    void embedding(float[] embedding) {
        this.embedding = embedding;
    }

    void addPendingReview(ReviewItem item) {
        pendingReviews.add(item);
    }

    List<ReviewItem> pendingReviews() {
        return List.copyOf(pendingReviews);
    }

    public static class Builder {
        private String type;
        private Map<String, Object> properties;
        private Set<String> uniqueProperties;
        private boolean vectorSearchEnabled = true;
        private double vectorThreshold = 0.8;
        private boolean humanReviewEnabled = true;
        private int fuzzyCandidateLimit = 500;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder properties(Map<String, Object> properties) {
            this.properties = properties;
            return this;
        }

        public Builder uniqueProperties(Set<String> uniqueProperties) {
            this.uniqueProperties = uniqueProperties;
            return this;
        }

        public Builder vectorSearchEnabled(boolean vectorSearchEnabled) {
            this.vectorSearchEnabled = vectorSearchEnabled;
            return this;
        }

        public Builder vectorThreshold(double vectorThreshold) {
            this.vectorThreshold = vectorThreshold;
            return this;
        }

        public Builder humanReviewEnabled(boolean humanReviewEnabled) {
            this.humanReviewEnabled = humanReviewEnabled;
            return this;
        }

        public Builder fuzzyCandidateLimit(int fuzzyCandidateLimit) {
            this.fuzzyCandidateLimit = fuzzyCandidateLimit;
            return this;
        }

        public ResolutionContext build() {
            return new ResolutionContext(this);
        }
    }
}
