package com.knowledge.importer.embedding;

import java.util.Optional;

/**
 * Gateway used when no embedding service is configured. Vector search is skipped for every candidate.
 */
public class NoOpEmbeddingGateway implements EmbeddingGateway {

    @Override
    public Optional<float[]> embed(String text) {
        return Optional.empty();
    }

    @Override
    public String getModel() {
        return "none";
    }
}
