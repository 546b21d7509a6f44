package com.knowledge.importer.review;

import java.util.List;

/**
 * Scored verdict for one candidate/stored pair.
 *
 * @param score          confidence in [0, 1]
 * @param action         what the score means
 * @param reason         human-readable explanation
 * @param reviewId       id of the review record to create, only for {@link MatchAction#HUMAN_REVIEW}
 * @param matchedMethods ids of the equality methods that fired
 */
public record MatchDecision(double score, MatchAction action, String reason, String reviewId,
                            List<String> matchedMethods) {

    public MatchDecision {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1], got " + score);
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        matchedMethods = matchedMethods == null ? List.of() : List.copyOf(matchedMethods);
    }

    public boolean isAutoMerge() {
        return action == MatchAction.AUTO_MERGE;
    }

    public boolean needsReview() {
        return action == MatchAction.HUMAN_REVIEW;
    }
}
