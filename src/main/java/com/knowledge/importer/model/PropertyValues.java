package com.knowledge.importer.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Value comparisons between candidate properties and stored properties.
 * Stores hand numbers back with their own boxed types, so numbers compare by value.
 */
public final class PropertyValues {

    /** Keys never compared: the caller-supplied identifier and the derived vector. */
    public static final Set<String> UNCOMPARED_KEYS = Set.of(CandidateNode.ID_PROPERTY, "embedding");

    private PropertyValues() {
    }

    public static boolean equal(Object stored, Object candidate) {
        if (stored instanceof Number a && candidate instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (stored instanceof List<?> a && candidate instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!equal(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(stored, candidate);
    }

    /**
     * Candidate entries that would change the stored node, skipping null values and uncompared keys.
     */
    public static Map<String, Object> changes(Map<String, Object> stored, Map<String, Object> candidate) {
        Map<String, Object> changed = new LinkedHashMap<>();
        candidate.forEach((key, value) -> {
            if (value != null && !UNCOMPARED_KEYS.contains(key) && !equal(stored.get(key), value)) {
                changed.put(key, value);
            }
        });
        return changed;
    }

    /**
     * True when the candidate has at least one comparable value and every one equals the stored value.
     */
    public static boolean sameAs(Map<String, Object> stored, Map<String, Object> candidate) {
        boolean compared = false;
        for (Map.Entry<String, Object> entry : candidate.entrySet()) {
            if (entry.getValue() == null || UNCOMPARED_KEYS.contains(entry.getKey())) {
                continue;
            }
            if (!equal(stored.get(entry.getKey()), entry.getValue())) {
                return false;
            }
            compared = true;
        }
        return compared;
    }
}
