package com.roster.dedup.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * FalkorDB-specific implementation using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = bindParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = bindParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        return results;
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        safeExecute("CREATE INDEX FOR (p:Person) ON (p.id)");
        safeExecute("CREATE INDEX FOR (p:Person) ON (p.name)");
        safeExecute("CREATE INDEX FOR (d:Document) ON (d.id)");
        safeExecute("CREATE INDEX FOR (t:TimelineEvent) ON (t.id)");
        log.info("graph.indexes.ensured graph={}", graphName);
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index already exists
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $param} placeholders with literal values.
     * Longer names are bound first so {@code $to} never clobbers {@code $toId}.
     */
    static String bindParams(String query, Map<String, Object> params) {
        String result = query;
        List<Map.Entry<String, Object>> ordered = params.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, Object> e) -> e.getKey().length()).reversed())
                .toList();
        for (Map.Entry<String, Object> entry : ordered) {
            result = result.replace("$" + entry.getKey(), formatValue(entry.getValue()));
        }
        return result;
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .map(FalkorDBConnection::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("graph.closed graph={}", graphName);
    }
}
