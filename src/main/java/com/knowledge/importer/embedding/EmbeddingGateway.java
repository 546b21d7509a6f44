package com.knowledge.importer.embedding;

import java.util.List;
import java.util.Optional;

/**
 * Turns descriptive text into a fixed-length vector using an external embedding service.
 *
 * <p>Failures are never thrown: an empty result tells the caller to skip the vector
 * path for that candidate.</p>
 */
public interface EmbeddingGateway {

    /**
     * @param text text to embed
     * @return the vector, or empty when the text is blank or the service call failed
     */
    Optional<float[]> embed(String text);

    /**
     * Embeds several texts; the result has one entry per input, in order.
     */
    default List<Optional<float[]>> embedBatch(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }

    String getModel();
}
