package com.knowledge.importer.normalize;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertyNormalizer Tests")
class PropertyNormalizerTest {

    private PropertyNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new PropertyNormalizer();
    }

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        @DisplayName("Strings, numbers and booleans pass through")
        void scalarsPassThrough() {
            assertEquals("Jon", normalizer.normalize("Jon"));
            assertEquals(42, normalizer.normalize(42));
            assertEquals(3.5, normalizer.normalize(3.5));
            assertEquals(true, normalizer.normalize(true));
            assertNull(normalizer.normalize(null));
        }

        @Test
        @DisplayName("Dates and times become ISO-8601 strings")
        void temporalsBecomeIsoStrings() {
            assertEquals("2024-03-01", normalizer.normalize(LocalDate.of(2024, 3, 1)));
            assertEquals("2024-03-01T10:15:30", normalizer.normalize(LocalDateTime.of(2024, 3, 1, 10, 15, 30)));
            assertEquals("2024-03-01T10:15:30Z", normalizer.normalize(Instant.parse("2024-03-01T10:15:30Z")));
            assertEquals("2024-03-01T10:15:30+02:00",
                    normalizer.normalize(OffsetDateTime.of(2024, 3, 1, 10, 15, 30, 0, ZoneOffset.ofHours(2))));
            assertEquals("1970-01-01T00:00:00Z", normalizer.normalize(new Date(0)));
        }

        @Test
        @DisplayName("Lone surrogates and replacement characters become '?'")
        void invalidCharactersReplaced() {
            assertEquals("ab?c", normalizer.normalize("ab\uD800c"));
            assertEquals("x?y", normalizer.normalize("x\uFFFDy"));
        }

        @Test
        @DisplayName("Valid surrogate pairs are kept")
        void surrogatePairsKept() {
            String emoji = "caf\u00e9 \uD83D\uDE00";
            assertEquals(emoji, normalizer.normalize(emoji));
        }

        @Test
        @DisplayName("Enums become their name")
        void enumsBecomeNames() {
            assertEquals("SECONDS", normalizer.normalize(java.util.concurrent.TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("Containers")
    class Containers {

        @Test
        @DisplayName("Nested map inside a property bag becomes a JSON string")
        void nestedMapBecomesJson() {
            Map<String, Object> address = new LinkedHashMap<>();
            address.put("city", "Springfield");
            address.put("zip", 62704);

            Map<String, Object> result = normalizer.normalizeProperties(Map.of("address", address));

            assertEquals("{\"city\":\"Springfield\",\"zip\":62704}", result.get("address"));
        }

        @Test
        @DisplayName("Top-level map normalizes entry by entry")
        void topLevelMapStaysAMap() {
            Object result = normalizer.normalize(Map.of("born", LocalDate.of(1990, 1, 2)));

            assertInstanceOf(Map.class, result);
            assertEquals("1990-01-02", ((Map<?, ?>) result).get("born"));
        }

        @Test
        @DisplayName("Lists and arrays normalize element-wise")
        void listsNormalizeElementWise() {
            assertEquals(List.of("2024-01-01", "x"), normalizer.normalize(List.of(LocalDate.of(2024, 1, 1), "x")));
            assertEquals(List.of(1, 2, 3), normalizer.normalize(new int[]{1, 2, 3}));
        }

        @Test
        @DisplayName("Map nested in a list becomes a JSON string")
        void mapInListBecomesJson() {
            Object result = normalizer.normalize(List.of(Map.of("k", "v")));

            assertEquals(List.of("{\"k\":\"v\"}"), result);
        }

        @Test
        @DisplayName("Null property bag yields an empty map")
        void nullBagYieldsEmptyMap() {
            assertTrue(normalizer.normalizeProperties(null).isEmpty());
        }

        @Test
        @DisplayName("Null values are kept as null entries")
        void nullValuesKept() {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("name", "Acme");
            raw.put("nickname", null);

            Map<String, Object> result = normalizer.normalizeProperties(raw);

            assertTrue(result.containsKey("nickname"));
            assertNull(result.get("nickname"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A value that cannot be converted becomes null instead of throwing")
        void unconvertibleValueBecomesNull() {
            Object broken = new Object() {
                @Override
                public String toString() {
                    throw new IllegalStateException("boom");
                }
            };

            assertNull(normalizer.normalize(broken));
        }

        @Test
        @DisplayName("Unknown types fall back to their string form")
        void unknownTypesUseToString() {
            assertEquals("[a]", normalizer.normalize(new StringBuilder("[a]")));
        }

        @Test
        @DisplayName("Normalizing twice is stable")
        void normalizationIsIdempotent() {
            Map<String, Object> raw = Map.of(
                    "name", "Jon",
                    "tags", Set.of("a"),
                    "meta", Map.of("k", 1),
                    "born", LocalDate.of(2000, 5, 6));

            Map<String, Object> once = normalizer.normalizeProperties(raw);
            Map<String, Object> twice = normalizer.normalizeProperties(once);

            assertEquals(once, twice);
        }
    }
}
