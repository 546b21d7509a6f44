package com.knowledge.importer.matcher;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Type-specific fuzzy equality for candidate and stored property sets.
 * The resolver only talks to this interface and never branches on the entity type itself.
 */
public interface NodeMatcher {

    String getName();

    /**
     * Properties whose values describe the entity in the embedding text, in order.
     */
    List<String> embeddingProperties();

    /**
     * Independent equality methods, in evaluation order.
     */
    List<EqualityMethod> equalityMethods();

    /**
     * Minimum cosine similarity for a vector hit to count as the same entity.
     */
    double similarityThreshold();

    /**
     * Properties counted when judging how rich or sparse a property set is.
     */
    List<String> identifyingProperties();

    /**
     * Names of attributes that both sides carry with clearly different values.
     */
    Set<String> conflictingAttributes(Map<String, Object> a, Map<String, Object> b);

    /**
     * True when the sets share an identifier (id, email, phone, SSN) or any equality method matches.
     */
    boolean matchNodes(Map<String, Object> a, Map<String, Object> b);

    /**
     * Text sent to the embedding service: non-blank embedding properties joined with {@code ". "}.
     */
    String embeddingText(Map<String, Object> properties);
}
