package com.knowledge.importer.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts arbitrary property values into values a property graph can store.
 *
 * <p>The store accepts scalars and homogeneous arrays only, so maps are flattened:</p>
 * <ul>
 *   <li>at depth 0 (the property bag itself) each entry is normalized on its own and
 *       any nested map value becomes a JSON string</li>
 *   <li>at depth &gt; 0 a whole map is serialized to a JSON string</li>
 *   <li>collections and arrays normalize element-wise</li>
 *   <li>dates and times become ISO-8601 strings</li>
 *   <li>strings are re-encoded, invalid sequences replaced with {@code ?}</li>
 * </ul>
 *
 * <p>Normalization never throws; a value that cannot be converted becomes {@code null}.</p>
 */
public class PropertyNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PropertyNormalizer.class);

    private static final char REPLACEMENT = '?';

    private final ObjectMapper objectMapper;

    public PropertyNormalizer() {
        this(new ObjectMapper());
    }

    public PropertyNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Normalizes a top-level property bag.
     *
     * @param properties raw properties
     * @return a new ordered map of storable values
     */
    public Map<String, Object> normalizeProperties(Map<String, ?> properties) {
        if (properties == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        properties.forEach((key, value) -> result.put(key, normalize(value, 1)));
        return result;
    }

    /**
     * Normalizes a single value at the given nesting depth.
     */
    public Object normalize(Object value, int depth) {
        try {
            return convert(value, depth);
        } catch (RuntimeException e) {
            log.warn("normalize.failed valueType={} depth={} error={}",
                    value.getClass().getName(), depth, e.getMessage());
            return null;
        }
    }

    public Object normalize(Object value) {
        return normalize(value, 0);
    }

    private Object convert(Object value, int depth) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return sanitize(s);
        }
        if (value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof Character c) {
            return sanitize(String.valueOf(c));
        }
        if (value instanceof byte[] bytes) {
            return sanitize(new String(bytes, StandardCharsets.UTF_8));
        }
        if (value instanceof TemporalAccessor temporal) {
            return formatTemporal(temporal);
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Map<?, ?> map) {
            return depth == 0 ? normalizeTopLevelMap(map) : toJson(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            for (Object element : collection) {
                result.add(normalize(element, depth + 1));
            }
            return result;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(normalize(Array.get(value, i), depth + 1));
            }
            return result;
        }
        log.warn("normalize.fallback valueType={} using toString", value.getClass().getName());
        return sanitize(value.toString());
    }

    private Map<String, Object> normalizeTopLevelMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        // entries sit one level down, so a nested map becomes JSON text
        map.forEach((k, v) -> result.put(String.valueOf(k), normalize(v, 1)));
        return result;
    }

    private String toJson(Map<?, ?> map) {
        try {
            return objectMapper.writeValueAsString(jsonCompatible(map));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize nested map: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Rewrites a nested structure so Jackson can serialize it without extra modules.
     */
    private Object jsonCompatible(Object value) {
        if (value == null || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof String s) {
            return sanitize(s);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), jsonCompatible(v)));
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            collection.forEach(element -> result.add(jsonCompatible(element)));
            return result;
        }
        if (value.getClass().isArray() && !(value instanceof byte[])) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(jsonCompatible(Array.get(value, i)));
            }
            return result;
        }
        return convert(value, 1);
    }

    private String formatTemporal(TemporalAccessor temporal) {
        if (temporal instanceof Instant instant) {
            return instant.toString();
        }
        if (temporal instanceof OffsetDateTime odt) {
            return odt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (temporal instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (temporal instanceof LocalDateTime ldt) {
            return ldt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (temporal instanceof LocalDate date) {
            return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (temporal instanceof LocalTime time) {
            return time.format(DateTimeFormatter.ISO_LOCAL_TIME);
        }
        return temporal.toString();
    }

    /**
     * Replaces lone surrogates and decoder replacement characters with {@code ?}.
     */
    static String sanitize(String value) {
        StringBuilder builder = null;
        int length = value.length();
        for (int i = 0; i < length; i++) {
            char c = value.charAt(i);
            boolean invalid;
            if (Character.isHighSurrogate(c)) {
                invalid = i + 1 >= length || !Character.isLowSurrogate(value.charAt(i + 1));
                if (!invalid) {
                    if (builder != null) {
                        builder.append(c).append(value.charAt(i + 1));
                    }
                    i++;
                    continue;
                }
            } else {
                invalid = Character.isLowSurrogate(c) || c == '\uFFFD';
            }
            if (invalid && builder == null) {
                builder = new StringBuilder(length);
                builder.append(value, 0, i);
            }
            if (builder != null) {
                builder.append(invalid ? REPLACEMENT : c);
            }
        }
        return builder != null ? builder.toString() : value;
    }
}
