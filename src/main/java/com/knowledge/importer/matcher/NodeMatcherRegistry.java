package com.knowledge.importer.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps entity types to their {@link NodeMatcher}. Lookup is case-insensitive and
 * unknown types fall back to a {@link DefaultNodeMatcher} built with the global threshold.
 *
 * <p>Built-in aliases: {@code Address}; {@code Person}, {@code User} and {@code Contact};
 * {@code Asset} and {@code Vehicle}.</p>
 */
public class NodeMatcherRegistry {
    private static final Logger log = LoggerFactory.getLogger(NodeMatcherRegistry.class);

    private final Map<String, NodeMatcher> matchers = new ConcurrentHashMap<>();
    private final NodeMatcher defaultMatcher;

    public NodeMatcherRegistry() {
        this(DefaultNodeMatcher.DEFAULT_THRESHOLD);
    }

    public NodeMatcherRegistry(double globalSimilarityThreshold) {
        this.defaultMatcher = new DefaultNodeMatcher(globalSimilarityThreshold);
        NodeMatcher address = new AddressNodeMatcher();
        NodeMatcher person = new PersonNodeMatcher();
        NodeMatcher asset = new AssetNodeMatcher();
        register("Address", address);
        register("Person", person);
        register("User", person);
        register("Contact", person);
        register("Asset", asset);
        register("Vehicle", asset);
    }

    /**
     * Registers or replaces the matcher for a type.
     */
    public NodeMatcherRegistry register(String type, NodeMatcher matcher) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        if (matcher == null) {
            throw new IllegalArgumentException("matcher must not be null");
        }
        matchers.put(key(type), matcher);
        return this;
    }

    public NodeMatcher matcherFor(String type) {
        if (type == null || type.isBlank()) {
            return defaultMatcher;
        }
        return matchers.getOrDefault(key(type), defaultMatcher);
    }

    public NodeMatcher defaultMatcher() {
        return defaultMatcher;
    }

    public double similarityThresholdFor(String type) {
        return matcherFor(type).similarityThreshold();
    }

    public String embeddingTextFor(String type, Map<String, Object> properties) {
        return matcherFor(type).embeddingText(properties);
    }

    /**
     * Shared identifier between the two property sets, whatever the type.
     *
     * @see AbstractNodeMatcher#identityMatch(Map, Map)
     */
    public Optional<String> identityMatch(Map<String, Object> a, Map<String, Object> b) {
        return AbstractNodeMatcher.identityMatch(a, b);
    }

    /**
     * True when the two property sets share an identifier or the type's matcher accepts them.
     * Matcher failures count as no match.
     */
    public boolean fuzzyMatch(String type, Map<String, Object> a, Map<String, Object> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (identityMatch(a, b).isPresent()) {
            return true;
        }
        NodeMatcher matcher = matcherFor(type);
        try {
            return matcher.matchNodes(a, b);
        } catch (RuntimeException e) {
            log.warn("matcher.failed type={} matcher={} error={}", type, matcher.getName(), e.getMessage());
            return false;
        }
    }

    private static String key(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
