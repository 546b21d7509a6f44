package com.knowledge.importer.review;

import com.knowledge.importer.matcher.EqualityMethod;
import com.knowledge.importer.matcher.NodeMatcher;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.NodeNames;
import com.knowledge.importer.model.PropertyValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns the equality methods of a type's matcher into a single confidence and a three-way decision.
 *
 * <p>Every method is evaluated. Those that fire contribute their score weighted by their
 * reliability; the weighted average is then adjusted by {@link ConfidenceModifiers},
 * clamped to [0, 1] and classified with {@link DecisionThresholds}. A shared identifier
 * (id, email, phone, SSN) or a candidate identical to the stored node merges outright.</p>
 */
public class ConfidenceScorer {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private final NodeMatcherRegistry registry;
    private final ConfidenceModifiers modifiers;
    private final DecisionThresholds thresholds;

    public ConfidenceScorer(NodeMatcherRegistry registry) {
        this(registry, ConfidenceModifiers.defaults(), DecisionThresholds.defaults());
    }

    public ConfidenceScorer(NodeMatcherRegistry registry, ConfidenceModifiers modifiers,
                            DecisionThresholds thresholds) {
        if (registry == null || modifiers == null || thresholds == null) {
            throw new IllegalArgumentException("registry, modifiers and thresholds are required");
        }
        this.registry = registry;
        this.modifiers = modifiers;
        this.thresholds = thresholds;
    }

    /**
     * Scores a stored node against a candidate and classifies the result.
     * A review id is assigned when the pair falls in the review band.
     */
    public MatchDecision evaluate(String type, Map<String, Object> existing, Map<String, Object> candidate) {
        Optional<String> identity = registry.identityMatch(existing, candidate);
        if (identity.isPresent()) {
            return new MatchDecision(1.0, MatchAction.AUTO_MERGE,
                    "Exact " + identity.get() + " match", null, List.of("identity_" + identity.get()));
        }
        if (PropertyValues.sameAs(existing, candidate)) {
            return new MatchDecision(1.0, MatchAction.AUTO_MERGE, "Identical properties", null, List.of());
        }

        Scoring scoring = score(type, existing, candidate);
        MatchAction action = thresholds.classify(scoring.confidence());
        String rounded = String.format(Locale.ROOT, "%.2f", scoring.confidence());
        return switch (action) {
            case AUTO_MERGE -> new MatchDecision(scoring.confidence(), action,
                    "High confidence match (" + rounded + ")", null, scoring.methods());
            case AUTO_REJECT -> new MatchDecision(scoring.confidence(), action,
                    scoring.methods().isEmpty()
                            ? "No equality method matched"
                            : "Low confidence match (" + rounded + ")",
                    null, scoring.methods());
            case HUMAN_REVIEW -> new MatchDecision(scoring.confidence(), action,
                    "Medium confidence requires human review (" + rounded + ")",
                    UUID.randomUUID().toString(), scoring.methods());
        };
    }

    /**
     * Weighted, modified and clamped confidence for the pair; 0 when no method fires.
     */
    public double confidence(String type, Map<String, Object> existing, Map<String, Object> candidate) {
        return score(type, existing, candidate).confidence();
    }

    public DecisionThresholds thresholds() {
        return thresholds;
    }

    private Scoring score(String type, Map<String, Object> existing, Map<String, Object> candidate) {
        NodeMatcher matcher = registry.matcherFor(type);
        List<String> fired = new ArrayList<>();
        double weightedScore = 0.0;
        double totalWeight = 0.0;
        for (EqualityMethod method : matcher.equalityMethods()) {
            try {
                if (method.matches(existing, candidate)) {
                    fired.add(method.id());
                    weightedScore += method.score(existing, candidate) * method.weight();
                    totalWeight += method.weight();
                }
            } catch (RuntimeException e) {
                log.warn("confidence.method_failed type={} method={} error={}", type, method.id(), e.getMessage());
            }
        }
        if (fired.isEmpty()) {
            return new Scoring(0.0, List.of());
        }
        double confidence = applyModifiers(weightedScore / totalWeight, matcher, existing, candidate);
        log.debug("confidence.scored type={} matcher={} methods={} confidence={}",
                type, matcher.getName(), fired, confidence);
        return new Scoring(confidence, fired);
    }

    private double applyModifiers(double base, NodeMatcher matcher,
                                  Map<String, Object> existing, Map<String, Object> candidate) {
        double confidence = base;
        int existingFields = countIdentifying(matcher, existing);
        int candidateFields = countIdentifying(matcher, candidate);
        if (existingFields >= modifiers.richnessMinFields() && candidateFields >= modifiers.richnessMinFields()) {
            confidence += modifiers.richnessBonus();
        } else if (existingFields <= modifiers.sparsityMaxFields() || candidateFields <= modifiers.sparsityMaxFields()) {
            confidence -= modifiers.sparsityPenalty();
        }
        if (modifiers.isGeneric(NodeNames.format(existing.get(CandidateNode.NAME_PROPERTY)))
                || modifiers.isGeneric(NodeNames.format(candidate.get(CandidateNode.NAME_PROPERTY)))) {
            confidence -= modifiers.genericityPenalty();
        }
        Set<String> conflicts = matcher.conflictingAttributes(existing, candidate);
        if (!conflicts.isEmpty()) {
            log.debug("confidence.conflict matcher={} attributes={}", matcher.getName(), conflicts);
            confidence -= modifiers.conflictPenalty();
        }
        return clamp(confidence);
    }

    private static int countIdentifying(NodeMatcher matcher, Map<String, Object> properties) {
        int count = 0;
        for (String key : matcher.identifyingProperties()) {
            if (!NodeNames.isBlank(properties.get(key))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Clamps to [0, 1] and rounds to four decimals so boundary scores classify exactly.
     */
    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        double bounded = Math.max(0.0, Math.min(1.0, value));
        return Math.round(bounded * 10_000.0) / 10_000.0;
    }

    private record Scoring(double confidence, List<String> methods) {
    }
}
