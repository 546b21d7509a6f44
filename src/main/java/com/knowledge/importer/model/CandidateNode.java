package com.knowledge.importer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * An unvalidated entity proposed for import by the extraction stage.
 *
 * @param type       the node label, e.g. "Person", "Address", "Asset"
 * @param properties ordered, schema-less property bag; may contain an {@code id}
 */
public record CandidateNode(String type, Map<String, Object> properties) {

    public static final String ID_PROPERTY = "id";
    public static final String NAME_PROPERTY = "name";

    public CandidateNode {
        type = type != null ? type.trim() : null;
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
    }

    public static CandidateNode of(String type, Map<String, Object> properties) {
        return new CandidateNode(type, properties);
    }

    /**
     * Builds a candidate from its raw document form.
     * Accepts {@code {type, name?, properties}}; when {@code properties} is absent every other
     * field is taken as a property. A top-level {@code name} fills {@code properties.name} when missing.
     */
    public static CandidateNode fromMap(Map<String, Object> raw) {
        Object type = raw.get("type");
        Map<String, Object> properties = new LinkedHashMap<>();
        Object nested = raw.get("properties");
        if (nested instanceof Map<?, ?> map) {
            map.forEach((k, v) -> properties.put(String.valueOf(k), v));
        } else {
            raw.forEach((k, v) -> {
                if (!"type".equals(k) && !"properties".equals(k)) {
                    properties.put(k, v);
                }
            });
        }
        Object topLevelName = raw.get(NAME_PROPERTY);
        if (NodeNames.isBlank(properties.get(NAME_PROPERTY)) && !NodeNames.isBlank(topLevelName)) {
            properties.put(NAME_PROPERTY, topLevelName);
        }
        return new CandidateNode(type != null ? type.toString() : null, properties);
    }

    /**
     * Returns the pre-assigned id, or null when absent or blank.
     */
    public Object id() {
        Object id = properties.get(ID_PROPERTY);
        return NodeNames.isBlank(id) ? null : id;
    }

    public String name() {
        return NodeNames.format(properties.get(NAME_PROPERTY));
    }

    /**
     * A type plus at least one property is the minimum needed to resolve a candidate.
     */
    public boolean isWellFormed() {
        return type != null && !type.isEmpty() && !properties.isEmpty();
    }

    /**
     * Key used to keep obvious duplicates within a batch on the same worker.
     */
    public String identityKey() {
        String prefix = type != null ? type.toLowerCase(Locale.ROOT) : "";
        Object id = id();
        if (id != null) {
            return prefix + ":id:" + id;
        }
        String name = name();
        if (name != null) {
            return prefix + ":name:" + name.toLowerCase(Locale.ROOT);
        }
        return prefix + ":props:" + properties.hashCode();
    }

    /**
     * Short description for log lines.
     */
    public String describe() {
        Object id = id();
        String name = name();
        return type + "{" + (id != null ? "id=" + id + ", " : "") + "name=" + name + "}";
    }
}
