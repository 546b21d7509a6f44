package com.knowledge.importer.matcher;

import java.util.List;
import java.util.Map;

/**
 * Fallback matcher for types without a dedicated rule set.
 * Compares ids, names or titles, and long descriptions.
 */
public class DefaultNodeMatcher extends AbstractNodeMatcher {

    public static final double DEFAULT_THRESHOLD = 0.8;

    private static final double NAME_THRESHOLD = 0.9;
    private static final double DESCRIPTION_THRESHOLD = 0.95;
    private static final int MIN_DESCRIPTION_LENGTH = 20;

    private final List<EqualityMethod> methods = List.of(
            EqualityMethod.exact("exact_id_match", 1.0, AbstractNodeMatcher::exactIdMatch),
            EqualityMethod.graded("name_similarity_match", 0.5,
                    (a, b) -> similar(label(a), label(b), NAME_THRESHOLD),
                    (a, b) -> similarity(label(a), label(b)) * 0.8),
            EqualityMethod.graded("description_match", 0.4,
                    DefaultNodeMatcher::descriptionMatch,
                    (a, b) -> similarity(text(a, "description"), text(b, "description")) * 0.7));

    public DefaultNodeMatcher() {
        this(DEFAULT_THRESHOLD);
    }

    public DefaultNodeMatcher(double similarityThreshold) {
        super("default", similarityThreshold);
    }

    @Override
    public List<String> embeddingProperties() {
        return List.of("name", "title", "description");
    }

    @Override
    public List<EqualityMethod> equalityMethods() {
        return methods;
    }

    @Override
    public List<String> identifyingProperties() {
        return List.of("id", "name", "title", "description");
    }

    private static String label(Map<String, Object> properties) {
        return firstText(properties, "name", "title");
    }

    private static boolean descriptionMatch(Map<String, Object> a, Map<String, Object> b) {
        String da = text(a, "description");
        String db = text(b, "description");
        return da != null && db != null
                && Math.min(da.length(), db.length()) >= MIN_DESCRIPTION_LENGTH
                && similar(da, db, DESCRIPTION_THRESHOLD);
    }
}
