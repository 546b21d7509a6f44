package com.knowledge.importer.review;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.importer.api.Page;
import com.knowledge.importer.api.PageRequest;
import com.knowledge.importer.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReviewQueue} persisted as {@code ReviewItem} nodes in the graph itself.
 * Property sets are kept as JSON strings since the store only holds scalar values.
 */
public class GraphReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(GraphReviewQueue.class);

    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {
    };

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphReviewQueue(GraphConnection connection) {
        this(connection, new ObjectMapper());
    }

    public GraphReviewQueue(GraphConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
        createIndexes();
    }

    private void createIndexes() {
        for (String property : List.of("id", "status", "entityType")) {
            try {
                connection.execute("CREATE INDEX FOR (ri:ReviewItem) ON (ri." + property + ")");
            } catch (Exception e) {
                log.debug("ReviewItem {} index may already exist: {}", property, e.getMessage());
            }
        }
    }

    @Override
    public ReviewItem submit(ReviewItem item) {
        String query = """
                CREATE (ri:ReviewItem {
                    id: $id,
                    entityType: $entityType,
                    existingNodeId: $existingNodeId,
                    existingProperties: $existingProperties,
                    candidateProperties: $candidateProperties,
                    confidenceScore: $confidenceScore,
                    matchedMethods: $matchedMethods,
                    reason: $reason,
                    status: $status,
                    createdAt: $createdAt
                })
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("id", item.getId());
        params.put("entityType", item.getEntityType());
        params.put("existingNodeId", item.getExistingNodeId());
        params.put("existingProperties", toJson(item.getExistingProperties()));
        params.put("candidateProperties", toJson(item.getCandidateProperties()));
        params.put("confidenceScore", item.getConfidenceScore());
        params.put("matchedMethods", item.getMatchedMethods());
        params.put("reason", item.getReason() != null ? item.getReason() : "");
        params.put("status", ReviewStatus.PENDING.name());
        params.put("createdAt", item.getCreatedAt().toString());
        connection.execute(query, params);
        log.debug("review.stored reviewId={} entityType={} store=graph", item.getId(), item.getEntityType());
        return item;
    }

    @Override
    public ReviewItem get(String reviewId) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (ri:ReviewItem {id: $reviewId})
                RETURN properties(ri) AS props
                """, Map.of("reviewId", reviewId));
        return rows.isEmpty() ? null : mapToReviewItem(rows.get(0));
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return pending("", Map.of(), "ri.createdAt ASC", page);
    }

    @Override
    public Page<ReviewItem> getPendingByEntityType(String entityType, PageRequest page) {
        return pending("AND toLower(ri.entityType) = toLower($entityType)",
                Map.of("entityType", entityType), "ri.createdAt ASC", page);
    }

    @Override
    public Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page) {
        return pending("AND ri.confidenceScore >= $minScore AND ri.confidenceScore <= $maxScore",
                Map.of("minScore", minScore, "maxScore", maxScore), "ri.confidenceScore DESC", page);
    }

    @Override
    public synchronized ReviewItem resolve(String reviewId, ReviewAction action, String reviewerId,
                                           String targetNodeId, String notes) {
        ReviewItem item = get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        Instant reviewedAt = Instant.now();
        connection.execute("""
                MATCH (ri:ReviewItem {id: $reviewId})
                SET ri.status = $status,
                    ri.action = $action,
                    ri.reviewedAt = $reviewedAt,
                    ri.reviewerId = $reviewerId,
                    ri.targetNodeId = $targetNodeId,
                    ri.notes = $notes
                """, Map.of(
                "reviewId", reviewId,
                "status", action.resultingStatus().name(),
                "action", action.name(),
                "reviewedAt", reviewedAt.toString(),
                "reviewerId", reviewerId != null ? reviewerId : "",
                "targetNodeId", targetNodeId != null ? targetNodeId : "",
                "notes", notes != null ? notes : ""));
        item.markResolved(action, reviewerId, targetNodeId, notes, reviewedAt);
        return item;
    }

    @Override
    public long countPending() {
        return count("", Map.of());
    }

    private Page<ReviewItem> pending(String filter, Map<String, Object> filterParams, String order,
                                     PageRequest page) {
        long total = count(filter, filterParams);
        Map<String, Object> params = new HashMap<>(filterParams);
        params.put("offset", page.offset());
        params.put("limit", page.limit());
        String query = """
                MATCH (ri:ReviewItem)
                WHERE ri.status = 'PENDING' %s
                RETURN properties(ri) AS props
                ORDER BY %s
                SKIP $offset LIMIT $limit
                """.formatted(filter, order);
        List<ReviewItem> items = connection.query(query, params).stream()
                .map(this::mapToReviewItem)
                .toList();
        return new Page<>(items, total, page);
    }

    private long count(String filter, Map<String, Object> params) {
        List<Map<String, Object>> rows = connection.query("""
                MATCH (ri:ReviewItem)
                WHERE ri.status = 'PENDING' %s
                RETURN count(ri) AS total
                """.formatted(filter), params);
        if (rows.isEmpty() || !(rows.get(0).get("total") instanceof Number total)) {
            return 0;
        }
        return total.longValue();
    }

    private ReviewItem mapToReviewItem(Map<String, Object> row) {
        Map<?, ?> props = row.get("props") instanceof Map<?, ?> map ? map : Map.of();
        ReviewItem.Builder builder = ReviewItem.builder()
                .id(string(props.get("id")))
                .entityType(string(props.get("entityType")))
                .existingNodeId(string(props.get("existingNodeId")))
                .existingProperties(fromJson(props.get("existingProperties")))
                .candidateProperties(fromJson(props.get("candidateProperties")))
                .confidenceScore(props.get("confidenceScore") instanceof Number n ? n.doubleValue() : 0.0)
                .matchedMethods(strings(props.get("matchedMethods")))
                .reason(blankToNull(props.get("reason")))
                .createdAt(instant(props.get("createdAt")))
                .status(ReviewStatus.valueOf(string(props.get("status"))))
                .reviewedAt(instant(props.get("reviewedAt")))
                .reviewerId(blankToNull(props.get("reviewerId")))
                .targetNodeId(blankToNull(props.get("targetNodeId")))
                .notes(blankToNull(props.get("notes")));
        String action = blankToNull(props.get("action"));
        if (action != null) {
            builder.action(ReviewAction.valueOf(action));
        }
        return builder.build();
    }

    private String toJson(Map<String, Object> properties) {
        try {
            return objectMapper.writeValueAsString(properties);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Review properties are not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> fromJson(Object value) {
        if (!(value instanceof String json) || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PROPERTIES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("review.properties_unreadable error={}", e.getMessage());
            return Map.of();
        }
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.forEach(element -> result.add(String.valueOf(element)));
        }
        return result;
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static String blankToNull(Object value) {
        return value == null || value.toString().isBlank() ? null : value.toString();
    }

    private static Instant instant(Object value) {
        String text = blankToNull(value);
        return text == null ? null : Instant.parse(text);
    }
}
