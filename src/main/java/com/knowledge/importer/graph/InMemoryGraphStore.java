package com.knowledge.importer.graph;

import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.model.PropertyValues;
import com.knowledge.importer.similarity.CosineSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * In-memory implementation of {@link GraphStore}.
 * Suitable for tests, previews and single-JVM use. Reads see a consistent
 * snapshot of each node; writes are serialized.
 */
public class InMemoryGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final ConcurrentMap<String, StoredNode> nodes = new ConcurrentHashMap<>();
    private final ConcurrentMap<RelationshipKey, Map<String, Object>> relationships = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    // ========== Pattern-match reads ==========

    @Override
    public Optional<GraphNode> findByNodeId(String nodeId) {
        StoredNode node = nodes.get(nodeId);
        return node == null ? Optional.empty() : Optional.of(node.snapshot());
    }

    @Override
    public Optional<GraphNode> findByProperty(String label, String key, Object value) {
        return ordered(label)
                .filter(node -> PropertyValues.equal(node.properties.get(key), value))
                .findFirst()
                .map(StoredNode::snapshot);
    }

    @Override
    public Optional<GraphNode> findByProperties(String label, Map<String, Object> properties) {
        if (properties.isEmpty()) {
            return Optional.empty();
        }
        return ordered(label)
                .filter(node -> properties.entrySet().stream()
                        .allMatch(e -> PropertyValues.equal(node.properties.get(e.getKey()), e.getValue())))
                .findFirst()
                .map(StoredNode::snapshot);
    }

    @Override
    public List<GraphNode> findByLabel(String label, int limit) {
        return ordered(label)
                .limit(limit)
                .map(StoredNode::snapshot)
                .toList();
    }

    @Override
    public Optional<GraphNode> findByName(String label, String name) {
        return findByProperty(label, "name", name);
    }

    @Override
    public Optional<GraphNode> findByPropertyContaining(String label, String text) {
        String needle = text.toLowerCase(Locale.ROOT);
        return ordered(label)
                .filter(node -> node.properties.values().stream()
                        .anyMatch(v -> v != null && v.toString().toLowerCase(Locale.ROOT).contains(needle)))
                .min(Comparator.comparingInt((StoredNode node) -> node.properties.size()))
                .map(StoredNode::snapshot);
    }

    // ========== Vector index ==========

    @Override
    public List<ScoredNode> vectorQuery(String label, float[] vector, int limit) {
        return ordered(label)
                .filter(node -> node.embedding != null)
                .map(node -> new ScoredNode(node.snapshot(), CosineSimilarity.compute(vector, node.embedding)))
                .sorted(Comparator.comparingDouble(ScoredNode::similarity).reversed())
                .limit(limit)
                .toList();
    }

    // ========== Writes ==========

    @Override
    public synchronized GraphNode createNode(String label, Map<String, Object> properties) {
        InputSanitizer.validateLabel(label);
        String nodeId = String.valueOf(sequence.getAndIncrement());
        StoredNode node = new StoredNode(nodeId, label, sequence.get());
        apply(node, properties);
        nodes.put(nodeId, node);
        log.debug("memory.node_created nodeId={} label={}", nodeId, label);
        return node.snapshot();
    }

    @Override
    public synchronized GraphNode updateNode(String nodeId, Map<String, Object> properties) {
        StoredNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalStateException("Node not found for update: " + nodeId);
        }
        apply(node, properties);
        return node.snapshot();
    }

    @Override
    public boolean relationshipExists(String fromNodeId, String type, String toNodeId) {
        return relationships.containsKey(new RelationshipKey(fromNodeId, type, toNodeId));
    }

    @Override
    public synchronized boolean createRelationship(String fromNodeId, String type, String toNodeId,
                                                   Map<String, Object> properties) {
        InputSanitizer.validateRelationshipType(type);
        if (!nodes.containsKey(fromNodeId) || !nodes.containsKey(toNodeId)) {
            throw new IllegalStateException("Both endpoints must exist: " + fromNodeId + " -> " + toNodeId);
        }
        Map<String, Object> stored = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                stored.put(key, value);
            }
        });
        return relationships.putIfAbsent(new RelationshipKey(fromNodeId, type, toNodeId), stored) == null;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    // ========== Inspection ==========

    public int nodeCount() {
        return nodes.size();
    }

    public int relationshipCount() {
        return relationships.size();
    }

    public Optional<Map<String, Object>> relationshipProperties(String fromNodeId, String type, String toNodeId) {
        return Optional.ofNullable(relationships.get(new RelationshipKey(fromNodeId, type, toNodeId)))
                .map(Map::copyOf);
    }

    public Optional<float[]> embeddingOf(String nodeId) {
        StoredNode node = nodes.get(nodeId);
        return node == null || node.embedding == null ? Optional.empty() : Optional.of(node.embedding.clone());
    }

    // ========== Internals ==========

    private Stream<StoredNode> ordered(String label) {
        return nodes.values().stream()
                .filter(node -> label == null || label.equals(node.label))
                .sorted(Comparator.comparingLong(node -> node.createdOrder));
    }

    private void apply(StoredNode node, Map<String, Object> properties) {
        Map<String, Object> merged = new LinkedHashMap<>(node.properties);
        float[] embedding = node.embedding;
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            if (EMBEDDING_PROPERTY.equals(entry.getKey())) {
                float[] vector = CosineSimilarity.toVector(entry.getValue());
                embedding = vector != null ? vector.clone() : null;
            } else if (entry.getValue() == null) {
                merged.remove(entry.getKey());
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        node.properties = merged;
        node.embedding = embedding;
    }

    private static final class StoredNode {
        private final String nodeId;
        private final String label;
        private final long createdOrder;
        private volatile Map<String, Object> properties = new LinkedHashMap<>();
        private volatile float[] embedding;

        private StoredNode(String nodeId, String label, long createdOrder) {
            this.nodeId = nodeId;
            this.label = label;
            this.createdOrder = createdOrder;
        }

        private GraphNode snapshot() {
            return new GraphNode(nodeId, label, properties);
        }
    }

    private record RelationshipKey(String fromNodeId, String type, String toNodeId) {
    }
}
