package com.knowledge.importer.graph;

/**
 * Thrown when the graph store cannot be reached at the start of an import run.
 */
public class GraphStoreUnavailableException extends RuntimeException {

    public GraphStoreUnavailableException(String message) {
        super(message);
    }

    public GraphStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
