package com.knowledge.importer.graph;

import java.util.List;
import java.util.Map;

/**
 * Low-level connection to a Cypher-speaking graph database.
 * Query text uses {@code $name} placeholders bound from the parameter map.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a write query.
     *
     * @param query  the Cypher query
     * @param params placeholder values
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Runs a read query.
     *
     * @param query  the Cypher query
     * @param params placeholder values
     * @return one map per result record, keyed by the RETURN aliases
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    @Override
    void close();
}
