package com.knowledge.importer.model;

import java.util.Collection;

/**
 * Helpers for turning loosely typed name values into a single display string.
 * Extraction output sometimes carries a list of aliases where a single name is expected.
 */
public final class NodeNames {

    private NodeNames() {
    }

    /**
     * Collapses a name value to one trimmed string.
     * Collections and arrays yield their first non-blank element.
     *
     * @param value raw name value
     * @return the trimmed name, or null when nothing usable is present
     */
    public static String format(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> values) {
            for (Object element : values) {
                String formatted = format(element);
                if (formatted != null) {
                    return formatted;
                }
            }
            return null;
        }
        if (value instanceof Object[] values) {
            for (Object element : values) {
                String formatted = format(element);
                if (formatted != null) {
                    return formatted;
                }
            }
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Returns true when the value is null or formats to nothing.
     */
    public static boolean isBlank(Object value) {
        return format(value) == null;
    }
}
