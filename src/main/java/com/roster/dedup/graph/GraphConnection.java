package com.roster.dedup.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding the person roster.
 * Abstracts the underlying graph database implementation.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params named parameters referenced as {@code $name}
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Executes a Cypher query and returns one map per result record, keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    String getGraphName();

    /**
     * Creates the lookup indexes used by deduplication if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
