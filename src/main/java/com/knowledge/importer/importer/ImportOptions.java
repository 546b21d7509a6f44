package com.knowledge.importer.importer;

import com.knowledge.importer.matcher.NodeMatcher;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.review.ConfidenceModifiers;
import com.knowledge.importer.review.DecisionThresholds;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Switches and limits for one import run.
 */
public class ImportOptions {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final int MAX_BATCH_SIZE = 1_000;
    public static final int DEFAULT_CONCURRENCY = 4;
    public static final Duration DEFAULT_CANDIDATE_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_FUZZY_CANDIDATE_LIMIT = 500;

    private final boolean dryRun;
    private final boolean enableVectorSearch;
    private final double similarityThreshold;
    private final Map<String, Double> vectorThresholds;
    private final boolean enableHumanReview;
    private final int batchSize;
    private final int concurrency;
    private final Duration candidateTimeout;
    private final int fuzzyCandidateLimit;
    private final Map<String, Set<String>> uniqueProperties;
    private final ConfidenceModifiers confidenceModifiers;
    private final DecisionThresholds decisionThresholds;
    private final ProgressCallback progressCallback;

    private ImportOptions(Builder builder) {
        this.dryRun = builder.dryRun;
        this.enableVectorSearch = builder.enableVectorSearch;
        this.similarityThreshold = builder.similarityThreshold;
        this.vectorThresholds = Map.copyOf(builder.vectorThresholds);
        this.enableHumanReview = builder.enableHumanReview;
        this.batchSize = builder.batchSize;
        this.concurrency = builder.concurrency;
        this.candidateTimeout = builder.candidateTimeout;
        this.fuzzyCandidateLimit = builder.fuzzyCandidateLimit;
        this.uniqueProperties = Map.copyOf(builder.uniqueProperties);
        this.confidenceModifiers = builder.confidenceModifiers;
        this.decisionThresholds = builder.decisionThresholds;
        this.progressCallback = builder.progressCallback;
    }

    public static ImportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isEnableVectorSearch() {
        return enableVectorSearch;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public boolean isEnableHumanReview() {
        return enableHumanReview;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public Duration getCandidateTimeout() {
        return candidateTimeout;
    }

    public int getFuzzyCandidateLimit() {
        return fuzzyCandidateLimit;
    }

    public ConfidenceModifiers getConfidenceModifiers() {
        return confidenceModifiers;
    }

    public DecisionThresholds getDecisionThresholds() {
        return decisionThresholds;
    }

    public ProgressCallback getProgressCallback() {
        return progressCallback;
    }

    /**
     * Vector threshold for a type: an explicit override, else the threshold of the type's own
     * matcher, else the global {@link #getSimilarityThreshold()}.
     */
    public double vectorThresholdFor(String type, NodeMatcherRegistry registry) {
        Double override = type != null ? vectorThresholds.get(type.toLowerCase(Locale.ROOT)) : null;
        if (override != null) {
            return override;
        }
        NodeMatcher matcher = registry.matcherFor(type);
        return matcher == registry.defaultMatcher() ? similarityThreshold : matcher.similarityThreshold();
    }

    /**
     * Property keys whose exact value identifies a node of the type.
     */
    public Set<String> uniquePropertiesFor(String type) {
        if (type == null) {
            return Set.of();
        }
        return uniqueProperties.getOrDefault(type.toLowerCase(Locale.ROOT), Set.of());
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .dryRun(dryRun)
                .enableVectorSearch(enableVectorSearch)
                .similarityThreshold(similarityThreshold)
                .enableHumanReview(enableHumanReview)
                .batchSize(batchSize)
                .concurrency(concurrency)
                .candidateTimeout(candidateTimeout)
                .fuzzyCandidateLimit(fuzzyCandidateLimit)
                .confidenceModifiers(confidenceModifiers)
                .decisionThresholds(decisionThresholds)
                .progressCallback(progressCallback);
        builder.vectorThresholds.putAll(vectorThresholds);
        builder.uniqueProperties.putAll(uniqueProperties);
        return builder;
    }

    @Override
    public String toString() {
        return "ImportOptions{dryRun=" + dryRun + ", enableVectorSearch=" + enableVectorSearch
                + ", similarityThreshold=" + similarityThreshold + ", enableHumanReview=" + enableHumanReview
                + ", batchSize=" + batchSize + ", concurrency=" + concurrency
                + ", candidateTimeout=" + candidateTimeout + '}';
    }

    public static class Builder {
        private boolean dryRun = false;
        private boolean enableVectorSearch = true;
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private final Map<String, Double> vectorThresholds = new HashMap<>();
        private boolean enableHumanReview = true;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int concurrency = DEFAULT_CONCURRENCY;
        private Duration candidateTimeout = DEFAULT_CANDIDATE_TIMEOUT;
        private int fuzzyCandidateLimit = DEFAULT_FUZZY_CANDIDATE_LIMIT;
        private final Map<String, Set<String>> uniqueProperties = new HashMap<>();
        private ConfidenceModifiers confidenceModifiers = ConfidenceModifiers.defaults();
        private DecisionThresholds decisionThresholds = DecisionThresholds.defaults();
        private ProgressCallback progressCallback = ProgressCallback.NOOP;

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder enableVectorSearch(boolean enableVectorSearch) {
            this.enableVectorSearch = enableVectorSearch;
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            requireUnitInterval("similarityThreshold", similarityThreshold);
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        /**
         * Overrides the vector threshold for one type, case-insensitively.
         */
        public Builder vectorThreshold(String type, double threshold) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("type must not be blank");
            }
            requireUnitInterval("vectorThreshold", threshold);
            this.vectorThresholds.put(type.trim().toLowerCase(Locale.ROOT), threshold);
            return this;
        }

        public Builder enableHumanReview(boolean enableHumanReview) {
            this.enableHumanReview = enableHumanReview;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
                throw new IllegalArgumentException("batchSize must be in 1.." + MAX_BATCH_SIZE + ", got " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder concurrency(int concurrency) {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be >= 1");
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder candidateTimeout(Duration candidateTimeout) {
            if (candidateTimeout == null || candidateTimeout.isZero() || candidateTimeout.isNegative()) {
                throw new IllegalArgumentException("candidateTimeout must be positive");
            }
            this.candidateTimeout = candidateTimeout;
            return this;
        }

        public Builder fuzzyCandidateLimit(int fuzzyCandidateLimit) {
            if (fuzzyCandidateLimit < 1) {
                throw new IllegalArgumentException("fuzzyCandidateLimit must be >= 1");
            }
            this.fuzzyCandidateLimit = fuzzyCandidateLimit;
            return this;
        }

        /**
         * Declares properties whose exact value identifies a node of the type.
         */
        public Builder uniqueProperties(String type, Set<String> keys) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("type must not be blank");
            }
            this.uniqueProperties.put(type.trim().toLowerCase(Locale.ROOT), Set.copyOf(keys));
            return this;
        }

        public Builder confidenceModifiers(ConfidenceModifiers confidenceModifiers) {
            if (confidenceModifiers == null) {
                throw new IllegalArgumentException("confidenceModifiers must not be null");
            }
            this.confidenceModifiers = confidenceModifiers;
            return this;
        }

        public Builder decisionThresholds(DecisionThresholds decisionThresholds) {
            if (decisionThresholds == null) {
                throw new IllegalArgumentException("decisionThresholds must not be null");
            }
            this.decisionThresholds = decisionThresholds;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback != null ? progressCallback : ProgressCallback.NOOP;
            return this;
        }

        public ImportOptions build() {
            return new ImportOptions(this);
        }

        private static void requireUnitInterval(String name, double value) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
            }
        }
    }
}
