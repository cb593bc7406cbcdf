package com.roster.dedup.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process {@link GraphConnection} that records every statement and answers queries with
 * canned rows, matched by a fragment of the query text.
 */
class RecordingGraphConnection implements GraphConnection {

    record Statement(String query, Map<String, Object> params) {}

    private final Map<String, List<Map<String, Object>>> responses = new LinkedHashMap<>();
    private final List<Statement> statements = new ArrayList<>();
    private RuntimeException failure;
    private boolean indexesCreated;
    private boolean closed;

    RecordingGraphConnection respondTo(String fragment, List<Map<String, Object>> rows) {
        responses.put(fragment, rows);
        return this;
    }

    RecordingGraphConnection failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    List<Statement> statements() {
        return statements;
    }

    Statement last() {
        return statements.get(statements.size() - 1);
    }

    boolean indexesCreated() {
        return indexesCreated;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        record(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        record(query, params);
        for (Map.Entry<String, List<Map<String, Object>>> entry : responses.entrySet()) {
            if (query.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    private void record(String query, Map<String, Object> params) {
        if (failure != null) {
            throw failure;
        }
        statements.add(new Statement(query, params));
    }

    @Override
    public String getGraphName() {
        return "test-roster";
    }

    @Override
    public void createIndexes() {
        indexesCreated = true;
    }

    @Override
    public void close() {
        closed = true;
    }
}
