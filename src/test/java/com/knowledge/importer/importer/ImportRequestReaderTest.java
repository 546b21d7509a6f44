package com.knowledge.importer.importer;

import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.CandidateRelationship;
import com.knowledge.importer.model.ImportRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImportRequestReaderTest {

    private static final String DOCUMENT = """
            {
              "entities": [
                {"type": "Person", "properties": {"name": "Jon Smith", "email": "jon@example.com"}},
                {"type": "Asset", "name": "Truck", "brand": "Ford"},
                "not an object"
              ],
              "relationships": [
                {"from": "Jon Smith", "to": "Truck", "type": "owns", "properties": {"since": 2020}}
              ]
            }
            """;

    private final ImportRequestReader reader = new ImportRequestReader();

    @Test
    @DisplayName("Should read entities and relationships")
    void testRead() {
        ImportRequest request = reader.read(DOCUMENT);

        assertEquals(3, request.entities().size());
        CandidateNode person = request.entities().get(0);
        assertEquals("Person", person.type());
        assertEquals("jon@example.com", person.properties().get("email"));

        CandidateNode asset = request.entities().get(1);
        assertEquals(Map.of("name", "Truck", "brand", "Ford"), asset.properties());

        CandidateRelationship owns = request.relationships().get(0);
        assertEquals("Jon Smith", owns.source());
        assertEquals("Truck", owns.target());
        assertEquals("OWNS", owns.normalizedType());
        assertEquals(2020, owns.properties().get("since"));
    }

    @Test
    @DisplayName("Entries that are not objects are kept as malformed candidates")
    void testNonObjectEntries() {
        ImportRequest request = reader.read("""
                {"entities": ["oops", 42], "relationships": [null]}
                """);

        assertEquals(2, request.entities().size());
        assertTrue(request.entities().stream().noneMatch(CandidateNode::isWellFormed));
        assertEquals(1, request.relationships().size());
        assertNull(request.relationships().get(0).source());
    }

    @Test
    @DisplayName("Missing sections are read as empty")
    void testMissingSections() {
        ImportRequest request = reader.read("{\"entities\": [{\"type\": \"Person\", \"name\": \"A\"}]}");

        assertEquals(1, request.entities().size());
        assertEquals(List.of(), request.relationships());
        assertEquals(1, request.size());
    }

    @Test
    @DisplayName("Should read from a stream and a file")
    void testReadStreamAndFile(@TempDir Path dir) throws Exception {
        ImportRequest fromStream = reader.read(new ByteArrayInputStream(DOCUMENT.getBytes(StandardCharsets.UTF_8)));
        assertEquals(4, fromStream.size());

        Path file = dir.resolve("import.json");
        Files.writeString(file, DOCUMENT);
        assertEquals(4, reader.read(file).size());
    }

    @Test
    @DisplayName("Should reject documents that are not JSON objects")
    void testInvalidDocument() {
        assertThrows(IllegalArgumentException.class, () -> reader.read("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> reader.read("{not json"));
        assertThrows(IllegalArgumentException.class, () -> reader.read("null"));
    }

    @Test
    @DisplayName("Should report a missing file")
    void testMissingFile(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> reader.read(dir.resolve("absent.json")));
    }
}
