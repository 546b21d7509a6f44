package com.knowledge.importer.importer;

import com.knowledge.importer.matcher.NodeMatcherRegistry;
import com.knowledge.importer.matcher.PersonNodeMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportOptions Tests")
class ImportOptionsTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        ImportOptions options = ImportOptions.defaults();

        assertFalse(options.isDryRun());
        assertTrue(options.isEnableVectorSearch());
        assertTrue(options.isEnableHumanReview());
        assertEquals(0.8, options.getSimilarityThreshold());
        assertEquals(50, options.getBatchSize());
        assertEquals(4, options.getConcurrency());
        assertEquals(Duration.ofSeconds(30), options.getCandidateTimeout());
        assertEquals(500, options.getFuzzyCandidateLimit());
        assertSame(ProgressCallback.NOOP, options.getProgressCallback());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 1001})
    @DisplayName("Batch size outside 1..1000 is rejected")
    void invalidBatchSize(int batchSize) {
        assertThrows(IllegalArgumentException.class, () -> ImportOptions.builder().batchSize(batchSize));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01})
    @DisplayName("Thresholds outside [0, 1] are rejected")
    void invalidThreshold(double threshold) {
        assertThrows(IllegalArgumentException.class, () -> ImportOptions.builder().similarityThreshold(threshold));
        assertThrows(IllegalArgumentException.class,
                () -> ImportOptions.builder().vectorThreshold("Person", threshold));
    }

    @Test
    @DisplayName("Other invalid settings are rejected")
    void otherValidation() {
        ImportOptions.Builder builder = ImportOptions.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.concurrency(0));
        assertThrows(IllegalArgumentException.class, () -> builder.candidateTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.candidateTimeout(null));
        assertThrows(IllegalArgumentException.class, () -> builder.fuzzyCandidateLimit(0));
        assertThrows(IllegalArgumentException.class, () -> builder.uniqueProperties(" ", Set.of("x")));
        assertThrows(IllegalArgumentException.class, () -> builder.confidenceModifiers(null));
        assertThrows(IllegalArgumentException.class, () -> builder.decisionThresholds(null));
    }

    @Test
    @DisplayName("Vector threshold: override, then matcher, then global")
    void vectorThresholdResolution() {
        NodeMatcherRegistry registry = new NodeMatcherRegistry();
        ImportOptions options = ImportOptions.builder()
                .similarityThreshold(0.75)
                .vectorThreshold("Asset", 0.6)
                .build();

        assertEquals(0.6, options.vectorThresholdFor("asset", registry));
        assertEquals(PersonNodeMatcher.DEFAULT_THRESHOLD, options.vectorThresholdFor("Person", registry));
        assertEquals(0.75, options.vectorThresholdFor("Widget", registry));
    }

    @Test
    @DisplayName("Unique properties are looked up case-insensitively")
    void uniqueProperties() {
        ImportOptions options = ImportOptions.builder()
                .uniqueProperties("Person", Set.of("ssn"))
                .build();

        assertEquals(Set.of("ssn"), options.uniquePropertiesFor("PERSON"));
        assertTrue(options.uniquePropertiesFor("Asset").isEmpty());
        assertTrue(options.uniquePropertiesFor(null).isEmpty());
    }

    @Test
    @DisplayName("toBuilder copies every setting")
    void toBuilderCopies() {
        ImportOptions original = ImportOptions.builder()
                .dryRun(true)
                .batchSize(10)
                .vectorThreshold("Asset", 0.6)
                .uniqueProperties("Person", Set.of("ssn"))
                .build();

        ImportOptions copy = original.toBuilder().concurrency(2).build();

        assertTrue(copy.isDryRun());
        assertEquals(10, copy.getBatchSize());
        assertEquals(2, copy.getConcurrency());
        assertEquals(0.6, copy.vectorThresholdFor("Asset", new NodeMatcherRegistry()));
        assertEquals(Set.of("ssn"), copy.uniquePropertiesFor("Person"));
        assertEquals(4, original.getConcurrency());
    }

    @Test
    @DisplayName("A null progress callback falls back to the no-op callback")
    void nullProgressCallback() {
        assertSame(ProgressCallback.NOOP, ImportOptions.builder().progressCallback(null).build().getProgressCallback());
    }
}
