package com.knowledge.importer.similarity;

/**
 * A string similarity measure in the range [0.0, 1.0].
 */
public interface SimilarityAlgorithm {

    /**
     * @return 1.0 for identical inputs, 0.0 for nothing in common or a missing side
     */
    double compute(String s1, String s2);

    String getName();
}
