package com.knowledge.importer.matcher;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AssetNodeMatcher Tests")
class AssetNodeMatcherTest {

    private AssetNodeMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new AssetNodeMatcher();
    }

    @Test
    @DisplayName("Brand is the first capitalized word")
    void extractsBrand() {
        assertEquals("FORD", AssetNodeMatcher.extractBrand(Map.of("name", "Ford F-150 truck")));
        assertEquals("TOYOTA", AssetNodeMatcher.extractBrand(Map.of("make", "Toyota", "name", "pickup")));
        assertEquals("TRUCK", AssetNodeMatcher.extractBrand(Map.of("name", "truck")));
        assertNull(AssetNodeMatcher.extractBrand(Map.of("name", "an")));
    }

    @Test
    @DisplayName("Model is explicit or the first name word with a digit")
    void extractsModel() {
        assertEquals("Tacoma", AssetNodeMatcher.extractModel(Map.of("model", "Tacoma", "name", "Toyota pickup")));
        assertEquals("F-150", AssetNodeMatcher.extractModel(Map.of("name", "Ford F-150 truck")));
        assertEquals("red", AssetNodeMatcher.extractModel(Map.of("name", "big red van")));
        assertNull(AssetNodeMatcher.extractModel(Map.of("name", "truck")));
    }

    @Test
    @DisplayName("Identifiers match after stripping punctuation")
    void uniqueIdentifierMatch() {
        assertTrue(AssetNodeMatcher.exactUniqueIdentifierMatch(
                Map.of("vin", "1HG-CM826"),
                Map.of("vin", "1hgcm826")));
        assertTrue(AssetNodeMatcher.exactSerialNumberMatch(
                Map.of("serial_number", "sn-001"),
                Map.of("serial_number", "SN-001")));
    }

    @Test
    @DisplayName("Brand spelled out in the other side's name")
    void brandCrossReference() {
        assertTrue(AssetNodeMatcher.brandAndModelMatch(
                Map.of("name", "GMC Sierra 1500"),
                Map.of("brand", "GMC", "model", "Sierra")));
    }

    @Test
    @DisplayName("Generic names still match on name similarity")
    void genericNamesMatchOnName() {
        Map<String, Object> ford = Map.of("name", "truck", "brand", "Ford");
        Map<String, Object> chevy = Map.of("name", "truck", "brand", "Chevy");

        assertFalse(AssetNodeMatcher.brandAndModelMatch(ford, chevy));
        assertTrue(AssetNodeMatcher.assetNameSimilarityMatch(ford, chevy));
        assertEquals(Set.of("brand"), matcher.conflictingAttributes(ford, chevy));
    }
}
