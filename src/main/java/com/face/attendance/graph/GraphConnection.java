package com.face.attendance.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding signatures, attendance rows and the audit trail.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher query
     * @param params query parameters, referenced as {@code $name}
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the property indexes used by attendance and audit lookups, if missing.
     */
    void createIndexes();

    @Override
    void close();
}
