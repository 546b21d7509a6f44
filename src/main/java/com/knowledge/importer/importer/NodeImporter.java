package com.knowledge.importer.importer;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.graph.InputSanitizer;
import com.knowledge.importer.logging.LogContext;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.model.NodeNames;
import com.knowledge.importer.model.PropertyValues;
import com.knowledge.importer.normalize.PropertyNormalizer;
import com.knowledge.importer.resolve.NodeResolver;
import com.knowledge.importer.resolve.Resolution;
import com.knowledge.importer.resolve.ResolutionContext;
import com.knowledge.importer.review.ReviewItem;
import com.knowledge.importer.review.ReviewSubmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Imports one candidate node: resolves it, then creates a new node or updates the one it
 * resolved to. Only the store write itself can fail the candidate.
 */
public class NodeImporter {
    private static final Logger log = LoggerFactory.getLogger(NodeImporter.class);

    private final GraphStore graphStore;
    private final NodeResolver resolver;
    private final NodeMatcherRegistry registry;
    private final PropertyNormalizer normalizer;
    private final ReviewSubmitter reviewSubmitter;
    private final MetricsService metrics;

    public NodeImporter(GraphStore graphStore, NodeResolver resolver, NodeMatcherRegistry registry,
                        PropertyNormalizer normalizer, ReviewSubmitter reviewSubmitter, MetricsService metrics) {
        this.graphStore = graphStore;
        this.resolver = resolver;
        this.registry = registry;
        this.normalizer = normalizer;
        this.reviewSubmitter = reviewSubmitter;
        this.metrics = metrics;
    }

    public void importNode(CandidateNode candidate, ImportOptions options, ImportStatistics stats) {
        stats.nodeSeen();
        if (!candidate.isWellFormed() || !InputSanitizer.isSafeIdentifier(candidate.type())) {
            stats.nodeSkipped();
            metrics.incrementNodeOutcome(candidate.type(), MetricsService.SKIPPED);
            log.warn("node.skipped reason=malformed candidate={}", candidate.describe());
            return;
        }
        try (LogContext ignored = LogContext.forCandidate(candidate.type(), candidate.name())) {
            Map<String, Object> properties = withSingleName(normalizer.normalizeProperties(candidate.properties()));
            ResolutionContext context = ResolutionContext.builder()
                    .type(candidate.type())
                    .properties(properties)
                    .uniqueProperties(options.uniquePropertiesFor(candidate.type()))
                    .vectorSearchEnabled(options.isEnableVectorSearch())
                    .vectorThreshold(options.vectorThresholdFor(candidate.type(), registry))
                    .humanReviewEnabled(options.isEnableHumanReview())
                    .fuzzyCandidateLimit(options.getFuzzyCandidateLimit())
                    .build();
            Resolution resolution = resolver.resolve(context);
            queueReviews(resolution, options, stats);

            if (resolution.isExisting()) {
                updateNode(candidate, resolution.node().get(), properties, options, stats);
            } else {
                createNode(candidate, properties, resolution.embedding(), options, stats);
            }
        }
    }

    private void queueReviews(Resolution resolution, ImportOptions options, ImportStatistics stats) {
        for (ReviewItem item : resolution.pendingReviews()) {
            if (options.isDryRun()) {
                log.info("review.dry_run existingNodeId={} score={}", item.getExistingNodeId(), item.getConfidenceScore());
                continue;
            }
            reviewSubmitter.submit(item);
            stats.reviewQueued();
        }
    }

    private void createNode(CandidateNode candidate, Map<String, Object> properties, float[] embedding,
                            ImportOptions options, ImportStatistics stats) {
        Map<String, Object> toCreate = creatableProperties(candidate.type(), properties);
        if (embedding != null && options.isEnableVectorSearch()) {
            toCreate.put(GraphStore.EMBEDDING_PROPERTY, embedding);
        }
        if (options.isDryRun()) {
            stats.nodeCreated();
            metrics.incrementNodeOutcome(candidate.type(), MetricsService.CREATED);
            log.info("node.created dryRun=true properties={}", toCreate.keySet());
            return;
        }
        try {
            GraphNode created = graphStore.createNode(candidate.type(), toCreate);
            stats.nodeCreated();
            metrics.incrementNodeOutcome(candidate.type(), MetricsService.CREATED);
            log.info("node.created nodeId={} embedding={}", created.nodeId(), embedding != null);
        } catch (RuntimeException e) {
            fail(candidate, "create failed: " + e.getMessage(), stats);
        }
    }

    private void updateNode(CandidateNode candidate, GraphNode existing, Map<String, Object> properties,
                            ImportOptions options, ImportStatistics stats) {
        stats.nodeDuplicate();
        metrics.incrementNodeOutcome(candidate.type(), MetricsService.DUPLICATE);
        Map<String, Object> changes = PropertyValues.changes(existing.properties(), properties);
        if (changes.isEmpty()) {
            stats.nodeSkipped();
            metrics.incrementNodeOutcome(candidate.type(), MetricsService.SKIPPED);
            log.debug("node.skipped reason=unchanged nodeId={}", existing.nodeId());
            return;
        }
        if (options.isDryRun()) {
            stats.nodeSkipped();
            metrics.incrementNodeOutcome(candidate.type(), MetricsService.SKIPPED);
            log.info("node.skipped reason=dry_run nodeId={} changes={}", existing.nodeId(), changes.keySet());
            return;
        }
        try {
            graphStore.updateNode(existing.nodeId(), changes);
            stats.nodeUpdated();
            metrics.incrementNodeOutcome(candidate.type(), MetricsService.UPDATED);
            log.info("node.updated nodeId={} changes={}", existing.nodeId(), changes.keySet());
        } catch (RuntimeException e) {
            fail(candidate, "update of " + existing.nodeId() + " failed: " + e.getMessage(), stats);
        }
    }

    /**
     * Collapses a list-valued name to its first entry, so resolution, update and create all
     * compare the same string the store keeps. A name with nothing usable is dropped.
     */
    static Map<String, Object> withSingleName(Map<String, Object> properties) {
        if (!properties.containsKey(CandidateNode.NAME_PROPERTY)) {
            return properties;
        }
        Map<String, Object> result = new LinkedHashMap<>(properties);
        String name = NodeNames.format(result.get(CandidateNode.NAME_PROPERTY));
        if (name == null) {
            result.remove(CandidateNode.NAME_PROPERTY);
        } else {
            result.put(CandidateNode.NAME_PROPERTY, name);
        }
        return result;
    }

    /**
     * Properties for a new node: no stray vector, and a name, {@code Unnamed <type>} when absent.
     */
    static Map<String, Object> creatableProperties(String type, Map<String, Object> properties) {
        Map<String, Object> result = new LinkedHashMap<>(properties);
        result.remove(GraphStore.EMBEDDING_PROPERTY);
        String name = NodeNames.format(result.get(CandidateNode.NAME_PROPERTY));
        result.put(CandidateNode.NAME_PROPERTY, name != null ? name : "Unnamed " + type.toLowerCase(Locale.ROOT));
        return result;
    }

    private void fail(CandidateNode candidate, String reason, ImportStatistics stats) {
        stats.nodeFailed(candidate.type(), candidate.describe(), reason);
        metrics.incrementNodeOutcome(candidate.type(), MetricsService.ERROR);
        log.error("node.failed candidate={} reason={}", candidate.describe(), reason);
    }
}
