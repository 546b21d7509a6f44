package com.knowledge.importer.graph;

import com.knowledge.importer.model.GraphNode;

/**
 * A vector index hit.
 *
 * @param node       the matching node
 * @param similarity cosine similarity in [0, 1], higher is closer
 */
public record ScoredNode(GraphNode node, double similarity) {
}
