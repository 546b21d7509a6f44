package com.knowledge.importer.matcher;

import java.util.Map;

/**
 * One independent way of deciding that two property sets describe the same thing.
 *
 * @param id     stable method identifier, e.g. {@code exact_email_match}
 * @param weight reliability weight used when combining fired methods into a confidence
 * @param test   the match predicate
 * @param scorer confidence of a positive match in [0, 1]
 */
public record EqualityMethod(String id, double weight, MatchTest test, MatchScorer scorer) {

    public EqualityMethod {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (weight <= 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be in (0, 1], got " + weight);
        }
    }

    /**
     * An identifier comparison; a positive result scores 1.0.
     */
    public static EqualityMethod exact(String id, double weight, MatchTest test) {
        return new EqualityMethod(id, weight, test, (a, b) -> 1.0);
    }

    /**
     * An attribute comparison whose positive result is scored by the given function.
     */
    public static EqualityMethod graded(String id, double weight, MatchTest test, MatchScorer scorer) {
        return new EqualityMethod(id, weight, test, scorer);
    }

    public boolean matches(Map<String, Object> a, Map<String, Object> b) {
        return test.matches(a, b);
    }

    public double score(Map<String, Object> a, Map<String, Object> b) {
        return Math.max(0.0, Math.min(1.0, scorer.score(a, b)));
    }

    @FunctionalInterface
    public interface MatchTest {
        boolean matches(Map<String, Object> a, Map<String, Object> b);
    }

    @FunctionalInterface
    public interface MatchScorer {
        double score(Map<String, Object> a, Map<String, Object> b);
    }
}
