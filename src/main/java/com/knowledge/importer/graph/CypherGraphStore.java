package com.knowledge.importer.graph;

import com.knowledge.importer.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link GraphStore} that issues Cypher through a {@link GraphConnection}.
 * Node identity is the database's internal id. Vector search uses the FalkorDB
 * vector index over the {@code embedding} property with cosine distance.
 */
public class CypherGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(CypherGraphStore.class);

    private static final String NODE_PROJECTION = "id(n) AS nodeId, labels(n) AS labels, properties(n) AS props";

    private final GraphConnection connection;
    private final int embeddingDimension;
    private final boolean ownsConnection;
    private final Set<String> indexedLabels = ConcurrentHashMap.newKeySet();

    public CypherGraphStore(GraphConnection connection, int embeddingDimension) {
        this(connection, embeddingDimension, false);
    }

    public CypherGraphStore(GraphConnection connection, int embeddingDimension, boolean ownsConnection) {
        this.connection = connection;
        this.embeddingDimension = embeddingDimension;
        this.ownsConnection = ownsConnection;
    }

    // ========== Pattern-match reads ==========

    @Override
    public Optional<GraphNode> findByNodeId(String nodeId) {
        String query = """
                MATCH (n)
                WHERE id(n) = $nodeId
                RETURN %s
                """.formatted(NODE_PROJECTION);
        return first(connection.query(query, Map.of("nodeId", toInternalId(nodeId))));
    }

    @Override
    public Optional<GraphNode> findByProperty(String label, String key, Object value) {
        InputSanitizer.validatePropertyKey(key);
        String query = """
                MATCH (n%s)
                WHERE n.`%s` = $value
                RETURN %s
                LIMIT 1
                """.formatted(labelClause(label), key, NODE_PROJECTION);
        Map<String, Object> params = new HashMap<>();
        params.put("value", value);
        return first(connection.query(query, params));
    }

    @Override
    public Optional<GraphNode> findByProperties(String label, Map<String, Object> properties) {
        if (properties.isEmpty()) {
            return Optional.empty();
        }
        List<String> predicates = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        int index = 0;
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            String param = "p" + index++;
            predicates.add("n.`" + InputSanitizer.validatePropertyKey(entry.getKey()) + "` = $" + param);
            params.put(param, entry.getValue());
        }
        String query = """
                MATCH (n%s)
                WHERE %s
                RETURN %s
                LIMIT 1
                """.formatted(labelClause(label), String.join(" AND ", predicates), NODE_PROJECTION);
        return first(connection.query(query, params));
    }

    @Override
    public List<GraphNode> findByLabel(String label, int limit) {
        String query = """
                MATCH (n%s)
                RETURN %s
                LIMIT $limit
                """.formatted(labelClause(label), NODE_PROJECTION);
        return connection.query(query, Map.of("limit", limit)).stream()
                .map(this::mapToNode)
                .toList();
    }

    @Override
    public Optional<GraphNode> findByName(String label, String name) {
        String query = """
                MATCH (n%s)
                WHERE n.name = $name
                RETURN %s
                LIMIT 1
                """.formatted(labelClause(label), NODE_PROJECTION);
        return first(connection.query(query, Map.of("name", name)));
    }

    @Override
    public Optional<GraphNode> findByPropertyContaining(String label, String text) {
        String query = """
                MATCH (n%s)
                WITH n, properties(n) AS p
                WHERE any(k IN keys(p) WHERE k <> 'embedding'
                      AND p[k] IS NOT NULL
                      AND toLower(toString(p[k])) CONTAINS toLower($text))
                RETURN %s
                ORDER BY size(keys(p)) ASC
                LIMIT 1
                """.formatted(labelClause(label), NODE_PROJECTION);
        return first(connection.query(query, Map.of("text", text)));
    }

    // ========== Vector index ==========

    @Override
    public List<ScoredNode> vectorQuery(String label, float[] vector, int limit) {
        InputSanitizer.validateLabel(label);
        String query = """
                CALL db.idx.vector.queryNodes($label, 'embedding', $limit, $vector)
                YIELD node, score
                RETURN id(node) AS nodeId, labels(node) AS labels, properties(node) AS props, score
                ORDER BY score ASC
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "label", label,
                "limit", limit,
                "vector", vector));
        List<ScoredNode> hits = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            double distance = row.get("score") instanceof Number n ? n.doubleValue() : 1.0;
            double similarity = Math.max(0.0, Math.min(1.0, 1.0 - distance));
            hits.add(new ScoredNode(mapToNode(row), similarity));
        }
        return hits;
    }

    // ========== Writes ==========

    @Override
    public GraphNode createNode(String label, Map<String, Object> properties) {
        InputSanitizer.validateLabel(label);
        ensureIndexes(label);
        String query = """
                CREATE (n:`%s` $props)
                RETURN %s
                """.formatted(label, NODE_PROJECTION);
        List<Map<String, Object>> rows = connection.query(query, Map.of("props", storable(properties)));
        return first(rows).orElseThrow(() ->
                new IllegalStateException("Create returned no node for label " + label));
    }

    @Override
    public GraphNode updateNode(String nodeId, Map<String, Object> properties) {
        String query = """
                MATCH (n)
                WHERE id(n) = $nodeId
                SET n += $props
                RETURN %s
                """.formatted(NODE_PROJECTION);
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "nodeId", toInternalId(nodeId),
                "props", storable(properties)));
        return first(rows).orElseThrow(() ->
                new IllegalStateException("Node not found for update: " + nodeId));
    }

    @Override
    public boolean relationshipExists(String fromNodeId, String type, String toNodeId) {
        InputSanitizer.validateRelationshipType(type);
        String query = """
                MATCH (a)-[r:`%s`]->(b)
                WHERE id(a) = $from AND id(b) = $to
                RETURN count(r) AS total
                """.formatted(type);
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "from", toInternalId(fromNodeId),
                "to", toInternalId(toNodeId)));
        return !rows.isEmpty() && rows.get(0).get("total") instanceof Number n && n.longValue() > 0;
    }

    /**
     * MERGE keeps one edge per type and ordered pair even when two workers write it at once;
     * {@code before} tells whether this call made it.
     */
    @Override
    public boolean createRelationship(String fromNodeId, String type, String toNodeId,
                                      Map<String, Object> properties) {
        InputSanitizer.validateRelationshipType(type);
        String query = """
                MATCH (a), (b)
                WHERE id(a) = $from AND id(b) = $to
                OPTIONAL MATCH (a)-[existing:`%1$s`]->(b)
                WITH a, b, count(existing) AS before
                MERGE (a)-[r:`%1$s`]->(b)
                ON CREATE SET r += $props
                RETURN before
                """.formatted(type);
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "from", toInternalId(fromNodeId),
                "to", toInternalId(toNodeId),
                "props", storable(properties)));
        if (rows.isEmpty()) {
            throw new IllegalStateException("Relationship endpoints not found: " + fromNodeId + " -> " + toNodeId);
        }
        return rows.get(0).get("before") instanceof Number n && n.longValue() == 0;
    }

    // ========== Lifecycle ==========

    @Override
    public boolean isAvailable() {
        return connection.isConnected();
    }

    @Override
    public void close() {
        if (ownsConnection) {
            connection.close();
        }
    }

    /**
     * Creates the lookup and vector indexes for a label the first time it is written.
     */
    void ensureIndexes(String label) {
        if (!indexedLabels.add(label)) {
            return;
        }
        safeExecute("CREATE INDEX FOR (n:`" + label + "`) ON (n.id)");
        safeExecute("CREATE INDEX FOR (n:`" + label + "`) ON (n.name)");
        safeExecute("CREATE VECTOR INDEX FOR (n:`" + label + "`) ON (n.embedding) " +
                "OPTIONS {dimension:" + embeddingDimension + ", similarityFunction:'cosine'}");
        log.debug("graph.indexes_ensured label={}", label);
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            // index already present
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    private String labelClause(String label) {
        return label == null ? "" : ":`" + InputSanitizer.validateLabel(label) + "`";
    }

    private Map<String, Object> storable(Map<String, Object> properties) {
        Map<String, Object> result = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                result.put(InputSanitizer.validatePropertyKey(key), value);
            }
        });
        return result;
    }

    private Optional<GraphNode> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToNode(rows.get(0)));
    }

    private GraphNode mapToNode(Map<String, Object> row) {
        String nodeId = String.valueOf(row.get("nodeId"));
        String label = null;
        if (row.get("labels") instanceof List<?> labels && !labels.isEmpty()) {
            label = String.valueOf(labels.get(0));
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        if (row.get("props") instanceof Map<?, ?> props) {
            props.forEach((k, v) -> {
                if (!EMBEDDING_PROPERTY.equals(k)) {
                    properties.put(String.valueOf(k), v);
                }
            });
        }
        return new GraphNode(nodeId, label, properties);
    }

    private static long toInternalId(String nodeId) {
        try {
            return Long.parseLong(nodeId);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a graph node id: " + nodeId, e);
        }
    }
}
