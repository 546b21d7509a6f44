package com.knowledge.importer.review;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Data-quality adjustments applied to the weighted method score.
 *
 * @param richnessBonus     added when both sides carry at least {@code richnessMinFields} identifying fields
 * @param sparsityPenalty   subtracted when either side carries at most {@code sparsityMaxFields}
 * @param genericityPenalty subtracted when either name is in {@code genericNames}
 * @param conflictPenalty   subtracted when a discriminating attribute disagrees
 * @param richnessMinFields identifying-field count that earns the bonus
 * @param sparsityMaxFields identifying-field count that triggers the penalty
 * @param genericNames      lower-case names too vague to identify anything
 */
public record ConfidenceModifiers(double richnessBonus,
                                  double sparsityPenalty,
                                  double genericityPenalty,
                                  double conflictPenalty,
                                  int richnessMinFields,
                                  int sparsityMaxFields,
                                  Set<String> genericNames) {

    public static final Set<String> DEFAULT_GENERIC_NAMES = Set.of(
            "truck", "car", "vehicle", "bike", "item", "asset", "equipment", "tool", "part", "component");

    public ConfidenceModifiers {
        requireFraction("richnessBonus", richnessBonus);
        requireFraction("sparsityPenalty", sparsityPenalty);
        requireFraction("genericityPenalty", genericityPenalty);
        requireFraction("conflictPenalty", conflictPenalty);
        if (sparsityMaxFields < 0 || richnessMinFields <= sparsityMaxFields) {
            throw new IllegalArgumentException("richnessMinFields must exceed sparsityMaxFields (>= 0)");
        }
        genericNames = genericNames == null ? Set.of() : genericNames.stream()
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static ConfidenceModifiers defaults() {
        return new ConfidenceModifiers(0.1, 0.2, 0.15, 0.4, 3, 1, DEFAULT_GENERIC_NAMES);
    }

    /**
     * Only the weighted average, clamped.
     */
    public static ConfidenceModifiers none() {
        return new ConfidenceModifiers(0.0, 0.0, 0.0, 0.0, 3, 1, Set.of());
    }

    public boolean isGeneric(String name) {
        return name != null && genericNames.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    private static void requireFraction(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
    }
}
