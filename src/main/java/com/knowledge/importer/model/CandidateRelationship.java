package com.knowledge.importer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A proposed directed edge between two named endpoints.
 *
 * @param source     source endpoint name or identifier
 * @param target     target endpoint name or identifier
 * @param type       raw relationship verb, upper-cased on storage
 * @param properties edge properties
 * @param sourceType optional label hint for the source endpoint
 * @param targetType optional label hint for the target endpoint
 */
public record CandidateRelationship(
        String source,
        String target,
        String type,
        Map<String, Object> properties,
        String sourceType,
        String targetType
) {

    public static final String DEFAULT_TYPE = "RELATED";

    public CandidateRelationship {
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
    }

    public static CandidateRelationship of(String source, String type, String target) {
        return new CandidateRelationship(source, target, type, Map.of(), null, null);
    }

    /**
     * Builds a relationship from its raw document form.
     * Endpoints are read from {@code source|from|from_id} and {@code target|to|to_id};
     * list-valued endpoints collapse to their first non-blank entry.
     */
    public static CandidateRelationship fromMap(Map<String, Object> raw) {
        Object source = firstPresent(raw, "source", "from", "from_id");
        Object target = firstPresent(raw, "target", "to", "to_id");
        Object type = raw.get("type");
        Map<String, Object> properties = new LinkedHashMap<>();
        if (raw.get("properties") instanceof Map<?, ?> map) {
            map.forEach((k, v) -> properties.put(String.valueOf(k), v));
        }
        return new CandidateRelationship(
                NodeNames.format(source),
                NodeNames.format(target),
                type != null ? type.toString() : null,
                properties,
                NodeNames.format(raw.get("source_type")),
                NodeNames.format(raw.get("target_type")));
    }

    /**
     * Upper-cased relationship type with non-word characters folded to underscores.
     */
    public String normalizedType() {
        String raw = NodeNames.format(type);
        if (raw == null) {
            return DEFAULT_TYPE;
        }
        String normalized = raw.toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9_]+", "_")
                .replaceAll("^_+|_+$", "");
        return normalized.isEmpty() ? DEFAULT_TYPE : normalized;
    }

    /**
     * Key that groups candidates describing the same edge, so they are imported one after another.
     */
    public String identityKey() {
        return normalizedType() + "|" + lower(source) + "|" + lower(target);
    }

    public String describe() {
        return "(" + source + ")-[" + normalizedType() + "]->(" + target + ")";
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static Object firstPresent(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (!NodeNames.isBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
