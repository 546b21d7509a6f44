package com.knowledge.importer.model;

import java.util.List;

/**
 * A batch of candidates handed to the import entry point.
 *
 * @param entities      candidate nodes, imported first
 * @param relationships candidate relationships, imported after all nodes
 */
public record ImportRequest(List<CandidateNode> entities, List<CandidateRelationship> relationships) {

    public ImportRequest {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    public static ImportRequest of(List<CandidateNode> entities, List<CandidateRelationship> relationships) {
        return new ImportRequest(entities, relationships);
    }

    public static ImportRequest ofEntities(List<CandidateNode> entities) {
        return new ImportRequest(entities, List.of());
    }

    public int size() {
        return entities.size() + relationships.size();
    }
}
