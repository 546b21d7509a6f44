package com.knowledge.importer.matcher;

import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.NodeNames;
import com.knowledge.importer.similarity.LevenshteinSimilarity;
import com.knowledge.importer.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared matching skeleton: a shared identifier first, then each equality method in order.
 * Embedding similarity is not consulted here; vector hits come from the vector index.
 */
public abstract class AbstractNodeMatcher implements NodeMatcher {
    private static final Logger log = LoggerFactory.getLogger(AbstractNodeMatcher.class);

    protected static final SimilarityAlgorithm LEVENSHTEIN = new LevenshteinSimilarity();

    static final int MIN_PHONE_DIGITS = 7;

    private final String name;
    private final double similarityThreshold;

    protected AbstractNodeMatcher(String name, double similarityThreshold) {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be in [0, 1]");
        }
        this.name = name;
        this.similarityThreshold = similarityThreshold;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public double similarityThreshold() {
        return similarityThreshold;
    }

    @Override
    public boolean matchNodes(Map<String, Object> a, Map<String, Object> b) {
        Optional<String> identifier = identityMatch(a, b);
        if (identifier.isPresent()) {
            log.debug("matcher.identity matcher={} identifier={}", name, identifier.get());
            return true;
        }
        for (EqualityMethod method : equalityMethods()) {
            try {
                if (method.matches(a, b)) {
                    log.debug("matcher.hit matcher={} method={}", name, method.id());
                    return true;
                }
            } catch (RuntimeException e) {
                log.warn("matcher.method_failed matcher={} method={} error={}", name, method.id(), e.getMessage());
            }
        }
        return false;
    }

    /**
     * Type-independent identity check: same id, same email (case-insensitive),
     * same phone digits or same SSN digits.
     *
     * @return the name of the matching identifier, if any
     */
    public static Optional<String> identityMatch(Map<String, Object> a, Map<String, Object> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        if (exactIdMatch(a, b)) {
            return Optional.of("id");
        }
        String emailA = text(a, "email");
        String emailB = text(b, "email");
        if (emailA != null && emailA.equalsIgnoreCase(emailB)) {
            return Optional.of("email");
        }
        String phoneA = digits(firstText(a, "phone", "phone_number"));
        String phoneB = digits(firstText(b, "phone", "phone_number"));
        if (phoneA.length() >= MIN_PHONE_DIGITS && phoneA.equals(phoneB)) {
            return Optional.of("phone");
        }
        String ssnA = digits(text(a, "ssn"));
        String ssnB = digits(text(b, "ssn"));
        if (!ssnA.isEmpty() && ssnA.equals(ssnB)) {
            return Optional.of("ssn");
        }
        return Optional.empty();
    }

    @Override
    public String embeddingText(Map<String, Object> properties) {
        return embeddingProperties().stream()
                .map(key -> text(properties, key))
                .filter(value -> value != null)
                .collect(Collectors.joining(". "));
    }

    @Override
    public Set<String> conflictingAttributes(Map<String, Object> a, Map<String, Object> b) {
        Set<String> conflicts = new LinkedHashSet<>();
        for (String key : discriminatingProperties()) {
            String va = comparable(key, a);
            String vb = comparable(key, b);
            if (va != null && vb != null && !va.equals(vb) && similarity(va, vb) < 0.8) {
                conflicts.add(key);
            }
        }
        return conflicts;
    }

    /**
     * Attributes whose disagreement argues against a match. None by default.
     */
    protected List<String> discriminatingProperties() {
        return List.of();
    }

    /**
     * Canonical form of a discriminating attribute; lower-cased text by default.
     */
    protected String comparable(String key, Map<String, Object> properties) {
        String value = text(properties, key);
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    // ========== Shared helpers ==========

    protected static boolean exactIdMatch(Map<String, Object> a, Map<String, Object> b) {
        String ia = text(a, CandidateNode.ID_PROPERTY);
        String ib = text(b, CandidateNode.ID_PROPERTY);
        return ia != null && ia.equals(ib);
    }

    /**
     * Trimmed string form of a property; list values yield their first non-blank element.
     */
    protected static String text(Map<String, Object> properties, String key) {
        return NodeNames.format(properties.get(key));
    }

    protected static String firstText(Map<String, Object> properties, String... keys) {
        for (String key : keys) {
            String value = text(properties, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    protected static double similarity(String a, String b) {
        return LEVENSHTEIN.compute(a, b);
    }

    protected static boolean similar(String a, String b, double threshold) {
        return a != null && b != null && similarity(a, b) >= threshold;
    }

    protected static String digits(String value) {
        return value == null ? "" : value.replaceAll("\\D", "");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{threshold=" + similarityThreshold + '}';
    }
}
