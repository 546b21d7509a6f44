package com.knowledge.importer.importer;

/**
 * Receives progress of an import run after each batch.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param phase     {@code "nodes"} or {@code "relationships"}
     * @param processed candidates of the phase processed so far
     * @param total     candidates in the phase
     */
    void onProgress(String phase, long processed, long total);

    ProgressCallback NOOP = (phase, processed, total) -> {
    };
}
