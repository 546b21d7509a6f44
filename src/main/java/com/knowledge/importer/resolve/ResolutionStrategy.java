package com.knowledge.importer.resolve;

import com.knowledge.importer.model.GraphNode;

import java.util.Optional;

/**
 * One step of the resolution cascade. Returning empty passes the candidate to the next step.
 */
public interface ResolutionStrategy {

    String name();

    Optional<GraphNode> resolve(ResolutionContext context);
}
