package com.knowledge.importer.resolve;

import com.knowledge.importer.embedding.EmbeddingGateway;
import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.review.ConfidenceScorer;
import com.knowledge.importer.tracing.Span;
import com.knowledge.importer.tracing.TracingService;
import com.knowledge.importer.vector.SimilaritySearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the resolution strategies in order and stops at the first that finds a stored node.
 * A strategy that throws is logged and counts as "no match"; the next one still runs.
 */
public class NodeResolver {
    private static final Logger log = LoggerFactory.getLogger(NodeResolver.class);

    private final List<ResolutionStrategy> strategies;
    private final TracingService tracing;

    public NodeResolver(List<ResolutionStrategy> strategies, TracingService tracing) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.tracing = tracing;
    }

    /**
     * Constraint, vector, fuzzy, then property matching.
     */
    public static NodeResolver standard(GraphStore graphStore, EmbeddingGateway embeddingGateway,
                                        NodeMatcherRegistry registry, ConfidenceScorer scorer,
                                        MetricsService metrics, TracingService tracing) {
        return new NodeResolver(List.of(
                new ConstraintStrategy(graphStore),
                new VectorStrategy(new SimilaritySearch(graphStore), embeddingGateway, registry, metrics),
                new FuzzyStrategy(graphStore, registry, scorer, metrics),
                new PropertyStrategy(graphStore)), tracing);
    }

    public List<ResolutionStrategy> strategies() {
        return strategies;
    }

    public Resolution resolve(ResolutionContext context) {
        try (Span span = tracing.startSpan(TracingService.RESOLVE_SPAN, Map.of("candidate.type", context.type()))) {
            for (ResolutionStrategy strategy : strategies) {
                Optional<GraphNode> found;
                try {
                    found = strategy.resolve(context);
                } catch (RuntimeException e) {
                    log.warn("resolve.strategy_failed strategy={} type={} error={}",
                            strategy.name(), context.type(), e.getMessage());
                    continue;
                }
                if (found.isPresent()) {
                    span.setAttribute("resolve.strategy", strategy.name());
                    return new Resolution(found, strategy.name(), context.pendingReviews(), context.embedding());
                }
            }
            span.setAttribute("resolve.strategy", "new");
            return new Resolution(Optional.empty(), null, context.pendingReviews(), context.embedding());
        }
    }
}
