package com.knowledge.importer.review;

/**
 * Confidence cut-offs for automatic decisions. Both bounds are inclusive:
 * {@code score >= autoMerge} merges, {@code score <= autoReject} rejects, anything between is reviewed.
 */
public record DecisionThresholds(double autoMerge, double autoReject) {

    public static final double DEFAULT_AUTO_MERGE = 0.9;
    public static final double DEFAULT_AUTO_REJECT = 0.3;

    public DecisionThresholds {
        if (autoMerge < 0.0 || autoMerge > 1.0 || autoReject < 0.0 || autoReject > 1.0) {
            throw new IllegalArgumentException("thresholds must be in [0, 1]");
        }
        if (autoReject >= autoMerge) {
            throw new IllegalArgumentException(
                    "autoReject (" + autoReject + ") must be below autoMerge (" + autoMerge + ")");
        }
    }

    public static DecisionThresholds defaults() {
        return new DecisionThresholds(DEFAULT_AUTO_MERGE, DEFAULT_AUTO_REJECT);
    }

    public MatchAction classify(double score) {
        if (score >= autoMerge) {
            return MatchAction.AUTO_MERGE;
        }
        if (score <= autoReject) {
            return MatchAction.AUTO_REJECT;
        }
        return MatchAction.HUMAN_REVIEW;
    }
}
