package com.knowledge.importer.resolve;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.model.NodeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exact lookup on the candidate's {@code id}, then on every property declared unique for the type.
 */
public class ConstraintStrategy implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(ConstraintStrategy.class);

    public static final String NAME = "constraint";

    private final GraphStore graphStore;

    public ConstraintStrategy(GraphStore graphStore) {
        this.graphStore = graphStore;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<GraphNode> resolve(ResolutionContext context) {
        Object id = context.properties().get(CandidateNode.ID_PROPERTY);
        if (!NodeNames.isBlank(id)) {
            Optional<GraphNode> byId = graphStore.findByProperty(context.type(), CandidateNode.ID_PROPERTY, id);
            if (byId.isPresent()) {
                log.debug("resolve.constraint_hit key=id nodeId={}", byId.get().nodeId());
                return byId;
            }
        }
        Map<String, Object> unique = new LinkedHashMap<>();
        for (String key : context.uniqueProperties()) {
            Object value = context.properties().get(key);
            if (!NodeNames.isBlank(value)) {
                unique.put(key, value);
            }
        }
        if (unique.isEmpty()) {
            return Optional.empty();
        }
        Optional<GraphNode> byUnique = graphStore.findByProperties(context.type(), unique);
        byUnique.ifPresent(node ->
                log.debug("resolve.constraint_hit keys={} nodeId={}", unique.keySet(), node.nodeId()));
        return byUnique;
    }
}
