package com.knowledge.importer.graph;

import java.util.regex.Pattern;

/**
 * Validation for identifiers that end up inside query text.
 * Labels, relationship types and property keys cannot be bound as parameters,
 * so they are checked against a strict identifier pattern before use.
 */
public final class InputSanitizer {

    public static final int MAX_IDENTIFIER_LENGTH = 128;

    public static final int MAX_CYPHER_VALUE_LENGTH = 100_000;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern RELATIONSHIP_TYPE = Pattern.compile("^[A-Z0-9_]+$");

    private InputSanitizer() {
    }

    /**
     * @throws IllegalArgumentException if the label is blank, too long or not a plain identifier
     */
    public static String validateLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label must not be null or blank");
        }
        if (label.length() > MAX_IDENTIFIER_LENGTH || !IDENTIFIER.matcher(label).matches()) {
            throw new IllegalArgumentException("Label must be a plain identifier, got: '" + label + "'");
        }
        return label;
    }

    /**
     * @throws IllegalArgumentException unless the type is upper-case letters, digits and underscores
     */
    public static String validateRelationshipType(String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("Relationship type must not be null or blank");
        }
        if (relationshipType.length() > MAX_IDENTIFIER_LENGTH
                || !RELATIONSHIP_TYPE.matcher(relationshipType).matches()) {
            throw new IllegalArgumentException(
                    "Relationship type must contain only A-Z, 0-9 and underscores, got: '" + relationshipType + "'");
        }
        return relationshipType;
    }

    public static String validatePropertyKey(String key) {
        if (!isSafeIdentifier(key)) {
            throw new IllegalArgumentException("Property key must be a plain identifier, got: '" + key + "'");
        }
        return key;
    }

    public static boolean isSafeIdentifier(String value) {
        return value != null
                && value.length() <= MAX_IDENTIFIER_LENGTH
                && IDENTIFIER.matcher(value).matches();
    }

    /**
     * Rejects oversized string payloads.
     */
    public static void sanitizeForCypher(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }
}
