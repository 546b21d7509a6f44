package com.knowledge.importer.resolve;

import com.knowledge.importer.graph.GraphStore;
import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.metrics.MetricsService;
import com.knowledge.importer.model.GraphNode;
import com.knowledge.importer.review.ConfidenceScorer;
import com.knowledge.importer.review.MatchDecision;
import com.knowledge.importer.review.ReviewItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares the candidate against stored nodes of its type with the type's matcher.
 *
 * <p>With human review enabled every pair is scored: the first auto-merge wins, a pair in
 * the review band produces a review record and is passed over, an auto-reject is passed over.
 * Without it, the first node the matcher accepts wins.</p>
 */
public class FuzzyStrategy implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(FuzzyStrategy.class);

    public static final String NAME = "fuzzy";

    private final GraphStore graphStore;
    private final NodeMatcherRegistry registry;
    private final ConfidenceScorer scorer;
    private final MetricsService metrics;

    public FuzzyStrategy(GraphStore graphStore, NodeMatcherRegistry registry, ConfidenceScorer scorer,
                         MetricsService metrics) {
        this.graphStore = graphStore;
        this.registry = registry;
        this.scorer = scorer;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<GraphNode> resolve(ResolutionContext context) {
        List<GraphNode> stored = graphStore.findByLabel(context.type(), context.fuzzyCandidateLimit());
        for (GraphNode node : stored) {
            if (!context.humanReviewEnabled()) {
                if (registry.fuzzyMatch(context.type(), node.properties(), context.properties())) {
                    log.debug("resolve.fuzzy_hit nodeId={}", node.nodeId());
                    return Optional.of(node);
                }
                continue;
            }
            MatchDecision decision = scorer.evaluate(context.type(), node.properties(), context.properties());
            metrics.recordMatchConfidence(decision.score());
            metrics.incrementMatchDecision(decision.action().label());
            switch (decision.action()) {
                case AUTO_MERGE -> {
                    log.debug("resolve.fuzzy_hit nodeId={} score={} reason={}",
                            node.nodeId(), decision.score(), decision.reason());
                    return Optional.of(node);
                }
                case HUMAN_REVIEW -> {
                    context.addPendingReview(reviewItem(context, node, decision));
                    log.debug("resolve.fuzzy_review nodeId={} score={} reviewId={}",
                            node.nodeId(), decision.score(), decision.reviewId());
                }
                case AUTO_REJECT -> {
                    if (!decision.matchedMethods().isEmpty()) {
                        log.debug("resolve.fuzzy_rejected nodeId={} score={}", node.nodeId(), decision.score());
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static ReviewItem reviewItem(ResolutionContext context, GraphNode node, MatchDecision decision) {
        return ReviewItem.builder()
                .id(decision.reviewId())
                .entityType(context.type())
                .existingNodeId(node.nodeId())
                .existingProperties(node.properties())
                .candidateProperties(withoutEmbedding(context))
                .confidenceScore(decision.score())
                .matchedMethods(decision.matchedMethods())
                .reason(decision.reason())
                .build();
    }

    private static Map<String, Object> withoutEmbedding(ResolutionContext context) {
        Map<String, Object> properties = new LinkedHashMap<>(context.properties());
        properties.remove(GraphStore.EMBEDDING_PROPERTY);
        return properties;
    }
}
