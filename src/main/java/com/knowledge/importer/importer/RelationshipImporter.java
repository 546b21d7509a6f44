package com.knowledge.importer.importer;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.InputSanitizer;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.CandidateRelationship;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.normalize.PropertyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Imports candidate relationships between nodes that already exist in the store.
 *
 * <p>Endpoints are looked up by {@code id}, then by exact name, then by a substring match on
 * any property within the hinted label, and finally across all labels. An endpoint that cannot
 * be found skips the relationship; it is not an error.</p>
 */
public class RelationshipImporter {
    private static final Logger log = LoggerFactory.getLogger(RelationshipImporter.class);

    private final GraphStore graphStore;
    private final PropertyNormalizer normalizer;
    private final MetricsService metrics;

    public RelationshipImporter(GraphStore graphStore, PropertyNormalizer normalizer, MetricsService metrics) {
        this.graphStore = graphStore;
        this.normalizer = normalizer;
        this.metrics = metrics;
    }

    public void importRelationship(CandidateRelationship candidate, ImportOptions options, ImportStatistics stats) {
        stats.relationshipSeen();
        if (candidate.source() == null || candidate.target() == null) {
            skip(candidate, "missing_endpoint", stats);
            return;
        }
        String type = candidate.normalizedType();
        if (!InputSanitizer.isSafeIdentifier(type)) {
            skip(candidate, "invalid_type", stats);
            return;
        }

        Optional<GraphNode> source = resolveEndpoint(candidate.source(), label(candidate.sourceType()));
        Optional<GraphNode> target = source.isPresent()
                ? resolveEndpoint(candidate.target(), label(candidate.targetType()))
                : Optional.empty();
        if (source.isEmpty() || target.isEmpty()) {
            skip(candidate, source.isEmpty() ? "source_not_found" : "target_not_found", stats);
            return;
        }

        String fromId = source.get().nodeId();
        String toId = target.get().nodeId();
        try {
            if (graphStore.relationshipExists(fromId, type, toId)) {
                skip(candidate, "exists", stats);
                return;
            }
            if (options.isDryRun()) {
                stats.relationshipCreated();
                metrics.incrementRelationshipOutcome(MetricsService.CREATED);
                log.info("relationship.created dryRun=true relationship={}", candidate.describe());
                return;
            }
            if (!graphStore.createRelationship(fromId, type, toId, edgeProperties(candidate))) {
                skip(candidate, "exists", stats);
                return;
            }
            stats.relationshipCreated();
            metrics.incrementRelationshipOutcome(MetricsService.CREATED);
            log.info("relationship.created from={} type={} to={}", fromId, type, toId);
        } catch (RuntimeException e) {
            stats.relationshipFailed(type, candidate.describe(), e.getMessage());
            metrics.incrementRelationshipOutcome(MetricsService.ERROR);
            log.error("relationship.failed relationship={} error={}", candidate.describe(), e.getMessage());
        }
    }

    // ========== Endpoint resolution ==========

    Optional<GraphNode> resolveEndpoint(String endpoint, String typeHint) {
        Optional<GraphNode> found = attempt("id", () ->
                graphStore.findByProperty(typeHint, CandidateNode.ID_PROPERTY, endpoint));
        if (found.isEmpty()) {
            found = attempt("name", () -> graphStore.findByName(typeHint, endpoint));
        }
        if (found.isEmpty()) {
            found = attempt("substring", () -> graphStore.findByPropertyContaining(typeHint, endpoint));
        }
        if (found.isEmpty() && typeHint != null) {
            log.debug("relationship.full_scan endpoint={} typeHint={}", endpoint, typeHint);
            found = attempt("full_scan", () -> graphStore.findByPropertyContaining(null, endpoint));
        }
        return found;
    }

    private Optional<GraphNode> attempt(String step, Supplier<Optional<GraphNode>> lookup) {
        try {
            return lookup.get();
        } catch (RuntimeException e) {
            log.warn("relationship.lookup_failed step={} error={}", step, e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, Object> edgeProperties(CandidateRelationship candidate) {
        Map<String, Object> properties = new LinkedHashMap<>();
        normalizer.normalizeProperties(candidate.properties()).forEach((key, value) -> {
            if (value != null) {
                properties.put(key, value);
            }
        });
        return properties;
    }

    /**
     * An unusable label hint is ignored rather than failing the lookup.
     */
    private static String label(String hint) {
        return InputSanitizer.isSafeIdentifier(hint) ? hint : null;
    }

    private void skip(CandidateRelationship candidate, String reason, ImportStatistics stats) {
        stats.relationshipSkipped();
        metrics.incrementRelationshipOutcome(MetricsService.SKIPPED);
        log.info("relationship.skipped reason={} relationship={}", reason, candidate.describe());
    }
}
