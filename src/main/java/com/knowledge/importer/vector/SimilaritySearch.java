package com.knowledge.importer.vector;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.ScoredNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Nearest-neighbour lookup over the store's vector index, restricted to one type and
 * to hits at or above a similarity threshold.
 */
public class SimilaritySearch {
    private static final Logger log = LoggerFactory.getLogger(SimilaritySearch.class);

    public static final int DEFAULT_LIMIT = 5;

    private final GraphStore graphStore;
    private final int limit;

    public SimilaritySearch(GraphStore graphStore) {
        this(graphStore, DEFAULT_LIMIT);
    }

    public SimilaritySearch(GraphStore graphStore, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        this.graphStore = graphStore;
        this.limit = limit;
    }

    /**
     * Hits of the given type whose similarity is at least {@code threshold}, most similar first.
     * A failing index query yields an empty list.
     */
    public List<ScoredNode> findSimilar(String type, float[] vector, double threshold) {
        if (vector == null || vector.length == 0) {
            return List.of();
        }
        try {
            List<ScoredNode> hits = graphStore.vectorQuery(type, vector, limit).stream()
                    .filter(hit -> hit.similarity() >= threshold)
                    .sorted(Comparator.comparingDouble(ScoredNode::similarity).reversed())
                    .limit(limit)
                    .toList();
            log.debug("vector.search type={} threshold={} hits={}", type, threshold, hits.size());
            return hits;
        } catch (RuntimeException e) {
            log.warn("vector.search_failed type={} error={}", type, e.getMessage());
            return List.of();
        }
    }

    public Optional<ScoredNode> bestMatch(String type, float[] vector, double threshold) {
        return findSimilar(type, vector, threshold).stream().findFirst();
    }
}
