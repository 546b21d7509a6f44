package com.knowledge.importer.resolve;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.model.NodeNames;
import com.knowledge.importer.model.PropertyValues;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last resort: a stored node of the type whose properties equal every non-empty candidate property.
 */
public class PropertyStrategy implements ResolutionStrategy {

    public static final String NAME = "property";

    private final GraphStore graphStore;

    public PropertyStrategy(GraphStore graphStore) {
        this.graphStore = graphStore;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<GraphNode> resolve(ResolutionContext context) {
        Map<String, Object> filter = new LinkedHashMap<>();
        context.properties().forEach((key, value) -> {
            if (!PropertyValues.UNCOMPARED_KEYS.contains(key) && !NodeNames.isBlank(value)) {
                filter.put(key, value);
            }
        });
        if (filter.isEmpty()) {
            return Optional.empty();
        }
        return graphStore.findByProperties(context.type(), filter);
    }
}
