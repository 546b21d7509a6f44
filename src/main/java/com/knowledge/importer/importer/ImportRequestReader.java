package com.knowledge.importer.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.importer.model.CandidateNode;
import com.knowledge.importer.model.CandidateRelationship;
import com.knowledge.importer.model.ImportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads an import document of the form:
 * <pre>
 * {
 *   "entities": [{"type": "Person", "properties": {"name": "Jon Smith"}}],
 *   "relationships": [{"source": "Jon Smith", "target": "Acme", "type": "works at"}]
 * }
 * </pre>
 * Entries that are not JSON objects are kept as malformed candidates, so the import skips and
 * counts them like any other unusable candidate.
 */
public class ImportRequestReader {
    private static final Logger log = LoggerFactory.getLogger(ImportRequestReader.class);

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ImportRequestReader() {
        this(new ObjectMapper());
    }

    public ImportRequestReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public ImportRequest read(String json) {
        try {
            return toRequest(objectMapper.readValue(json, DOCUMENT));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid import document: " + e.getOriginalMessage(), e);
        }
    }

    public ImportRequest read(InputStream input) {
        try {
            return toRequest(objectMapper.readValue(input, DOCUMENT));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid import document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read import document", e);
        }
    }

    public ImportRequest read(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return read(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read import document " + path, e);
        }
    }

    private ImportRequest toRequest(Map<String, Object> document) {
        if (document == null) {
            throw new IllegalArgumentException("Invalid import document: empty");
        }
        List<CandidateNode> entities = new ArrayList<>();
        for (Map<String, Object> raw : objects(document.get("entities"), "entities")) {
            entities.add(CandidateNode.fromMap(raw));
        }
        List<CandidateRelationship> relationships = new ArrayList<>();
        for (Map<String, Object> raw : objects(document.get("relationships"), "relationships")) {
            relationships.add(CandidateRelationship.fromMap(raw));
        }
        log.debug("import.document_read entities={} relationships={}", entities.size(), relationships.size());
        return ImportRequest.of(entities, relationships);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> objects(Object section, String name) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (!(section instanceof List<?> entries)) {
            return result;
        }
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> map) {
                result.add((Map<String, Object>) map);
            } else {
                log.warn("import.document_entry_malformed section={} entry={}", name, entry);
                result.add(Map.of());
            }
        }
        return result;
    }
}
