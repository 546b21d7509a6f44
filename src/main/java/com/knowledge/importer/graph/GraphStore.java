package com.knowledge.importer.graph;

import com.knowledge.importer.model.GraphNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The property-graph operations the import pipeline relies on.
 *
 * <p>Four capability shapes are covered: pattern-match reads by label and property predicates,
 * nearest-neighbour queries against a vector index, node create/update, and creation of typed
 * directed edges between existing nodes. A {@code null} label means "any label".
 * Each call is its own transaction; no call spans several candidates.</p>
 */
public interface GraphStore extends AutoCloseable {

    String EMBEDDING_PROPERTY = "embedding";

    // ========== Pattern-match reads ==========

    Optional<GraphNode> findByNodeId(String nodeId);

    /**
     * First node of the label whose property equals the value.
     */
    Optional<GraphNode> findByProperty(String label, String key, Object value);

    /**
     * First node of the label whose properties equal every given entry.
     */
    Optional<GraphNode> findByProperties(String label, Map<String, Object> properties);

    /**
     * Up to {@code limit} nodes carrying the label.
     */
    List<GraphNode> findByLabel(String label, int limit);

    /**
     * First node whose {@code name} equals the given value exactly.
     */
    Optional<GraphNode> findByName(String label, String name);

    /**
     * First node with any property containing the text, case-insensitively.
     * Nodes with fewer properties are preferred.
     */
    Optional<GraphNode> findByPropertyContaining(String label, String text);

    // ========== Vector index ==========

    /**
     * Nearest neighbours among nodes of the label that carry an embedding, closest first.
     */
    List<ScoredNode> vectorQuery(String label, float[] vector, int limit);

    // ========== Writes ==========

    /**
     * Creates a node. An {@code embedding} entry holding a {@code float[]} is stored as a vector.
     */
    GraphNode createNode(String label, Map<String, Object> properties);

    /**
     * Merges the given properties into an existing node, leaving other properties untouched.
     */
    GraphNode updateNode(String nodeId, Map<String, Object> properties);

    boolean relationshipExists(String fromNodeId, String type, String toNodeId);

    /**
     * Creates the edge unless one of the same type already joins the ordered pair. The check and
     * the write are one atomic step.
     *
     * @return true if this call created the edge, false if it already existed
     */
    boolean createRelationship(String fromNodeId, String type, String toNodeId, Map<String, Object> properties);

    // ========== Lifecycle ==========

    boolean isAvailable();

    @Override
    default void close() {
    }
}
