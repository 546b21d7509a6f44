package com.knowledge.importer.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class AddressNormalizerTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "123 North Main Street, 123 n main st",
            "123 N. Main St., 123 n main st",
            "500 West Elm Avenue, 500 w elm ave",
            "42 Lakeshore Boulevard, 42 lakeshore blvd"
    })
    @DisplayName("Street suffixes and directionals are abbreviated")
    void normalizesStreet(String raw, String expected) {
        assertEquals(expected, AddressNormalizer.normalizeStreet(raw));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Illinois, IL",
            "il, IL",
            "Calif., CA",
            "new york, NY",
            "District of Columbia, DC"
    })
    @DisplayName("States map to two-letter codes")
    void normalizesState(String raw, String expected) {
        assertEquals(expected, AddressNormalizer.normalizeState(raw));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "NYC, new york",
            "Austin TX, austin",
            "Saint Louis, st louis",
            "San Fran, san francisco"
    })
    @DisplayName("Cities resolve aliases and drop trailing state codes")
    void normalizesCity(String raw, String expected) {
        assertEquals(expected, AddressNormalizer.normalizeCity(raw));
    }

    @Test
    @DisplayName("Blank country means usa")
    void normalizesCountry() {
        assertEquals("usa", AddressNormalizer.normalizeCountry(null));
        assertEquals("usa", AddressNormalizer.normalizeCountry("United States"));
        assertEquals("uk", AddressNormalizer.normalizeCountry("U.K."));
        assertEquals("norway", AddressNormalizer.normalizeCountry("Norway"));
    }

    @Test
    @DisplayName("ZIP codes keep their first five digits")
    void zip5() {
        assertEquals("62704", AddressNormalizer.zip5("62704-1234"));
        assertEquals("02134", AddressNormalizer.zip5("02134"));
        assertNull(AddressNormalizer.zip5("n/a"));
        assertNull(AddressNormalizer.zip5(null));
    }

    @Test
    @DisplayName("Street components split number and name")
    void streetComponents() {
        AddressNormalizer.StreetComponents range = AddressNormalizer.streetComponents("120-124 main st");
        assertEquals("120", range.number());
        assertEquals("main st", range.name());

        AddressNormalizer.StreetComponents unnumbered = AddressNormalizer.streetComponents("main st");
        assertNull(unnumbered.number());
        assertEquals("main st", unnumbered.name());

        assertNull(AddressNormalizer.streetComponents(null).name());
    }
}
