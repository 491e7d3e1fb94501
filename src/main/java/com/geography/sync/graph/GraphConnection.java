package com.geography.sync.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding canonical units, tenant units,
 * conflict cases and the sync ledger.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns each record as a column-to-value map.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes the geography repositories query by. Existing indexes are left alone.
     */
    void createIndexes();

    @Override
    void close();
}
