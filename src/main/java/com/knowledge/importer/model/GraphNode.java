package com.knowledge.importer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node persisted in the graph store.
 *
 * @param nodeId     store-assigned identifier
 * @param label      primary type label
 * @param properties stored properties, without the embedding vector
 */
public record GraphNode(String nodeId, String label, Map<String, Object> properties) {

    public GraphNode {
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
    }

    public Object property(String key) {
        return properties.get(key);
    }

    public String name() {
        return NodeNames.format(properties.get(CandidateNode.NAME_PROPERTY));
    }
}
