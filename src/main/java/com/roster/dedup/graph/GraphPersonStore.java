package com.roster.dedup.graph;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.core.model.PersonStatus;
import com.roster.dedup.core.model.TimelineEvent;
import com.roster.dedup.store.PersonStore;
import com.roster.dedup.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * FalkorDB-backed {@link PersonStore}.
 * Every driver failure surfaces as a {@link StoreException}.
 */
public class GraphPersonStore implements PersonStore {
    private static final Logger log = LoggerFactory.getLogger(GraphPersonStore.class);

    private final CypherExecutor executor;

    public GraphPersonStore(GraphConnection connection) {
        this(new CypherExecutor(connection));
    }

    public GraphPersonStore(CypherExecutor executor) {
        this.executor = executor;
    }

    // ========== Bulk reads ==========

    @Override
    public List<Person> findAllPersons() {
        return run("findAllPersons", () -> executor.findAllPersons().stream()
                .map(GraphPersonStore::mapPerson)
                .toList());
    }

    @Override
    public List<PersonDocument> findAllPersonDocuments() {
        return run("findAllPersonDocuments", () -> executor.findAllPersonDocuments().stream()
                .map(row -> new PersonDocument(
                        toLong(row.get("id")),
                        toLong(row.get("personId")),
                        toLong(row.get("documentId")),
                        (String) row.get("context")))
                .toList());
    }

    @Override
    public List<Connection> findAllConnections() {
        return run("findAllConnections", () -> executor.findAllConnections().stream()
                .map(row -> new Connection(
                        toLong(row.get("id")),
                        toLong(row.get("personId1")),
                        toLong(row.get("personId2")),
                        (String) row.get("connectionType"),
                        (String) row.get("description"),
                        (int) toLong(row.get("strength"))))
                .toList());
    }

    @Override
    public List<TimelineEvent> findAllTimelineEvents() {
        return run("findAllTimelineEvents", () -> executor.findAllTimelineEvents().stream()
                .map(row -> new TimelineEvent(
                        toLong(row.get("id")),
                        stringValue(row.get("date")),
                        (String) row.get("title"),
                        toLongList(row.get("personIds"))))
                .toList());
    }

    // ========== Point reads ==========

    @Override
    public long countPersons() {
        return run("countPersons", () -> executor.countPersons());
    }

    @Override
    public Optional<Person> findPersonById(long id) {
        return run("findPersonById", () -> executor.findPersonById(id).stream()
                .findFirst()
                .map(GraphPersonStore::mapPerson));
    }

    @Override
    public Set<Long> findExistingIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Set.of();
        }
        return run("findExistingIds", () -> {
            Set<Long> existing = new HashSet<>();
            for (Map<String, Object> row : executor.findExistingIds(ids)) {
                existing.add(toLong(row.get("id")));
            }
            return existing;
        });
    }

    @Override
    public int countDocumentLinks(long personId) {
        return run("countDocumentLinks", () -> (int) executor.countDocumentLinks(personId));
    }

    @Override
    public int countConnections(long personId) {
        return run("countConnections", () -> (int) executor.countConnections(personId));
    }

    // ========== Person-document links ==========

    @Override
    public void reassignDocuments(Collection<Long> fromIds, long toId) {
        if (fromIds.isEmpty()) {
            return;
        }
        execute("reassignDocuments", () -> executor.reassignDocuments(fromIds, toId));
    }

    @Override
    public int deleteDuplicateDocumentLinks(long personId) {
        return run("deleteDuplicateDocumentLinks", () -> (int) executor.deleteDuplicateDocumentLinks(personId));
    }

    @Override
    public int deleteDocumentLinks(Collection<Long> personIds) {
        if (personIds.isEmpty()) {
            return 0;
        }
        return run("deleteDocumentLinks", () -> (int) executor.deleteDocumentLinks(personIds));
    }

    // ========== Connections ==========

    @Override
    public void reassignConnections(Collection<Long> fromIds, long toId) {
        if (fromIds.isEmpty()) {
            return;
        }
        execute("reassignConnections", () -> executor.reassignConnections(fromIds, toId));
    }

    @Override
    public int deleteSelfLoopConnections() {
        return run("deleteSelfLoopConnections", () -> (int) executor.deleteSelfLoopConnections());
    }

    @Override
    public int deleteConnectionsReferencing(Collection<Long> personIds) {
        if (personIds.isEmpty()) {
            return 0;
        }
        return run("deleteConnectionsReferencing", () -> (int) executor.deleteConnectionsReferencing(personIds));
    }

    @Override
    public int deleteDuplicateConnections() {
        return run("deleteDuplicateConnections", () -> {
            long parallel = executor.deleteDuplicateConnections();
            long selfLoops = executor.deleteSelfLoopConnections();
            return (int) (parallel + selfLoops);
        });
    }

    // ========== Timeline events ==========

    @Override
    public void replaceInTimelineEvents(Collection<Long> fromIds, long toId) {
        execute("replaceInTimelineEvents", () -> {
            for (Long fromId : fromIds) {
                executor.replaceInTimelineEvents(fromId, toId);
            }
        });
    }

    @Override
    public void removeFromTimelineEvents(Collection<Long> personIds) {
        if (personIds.isEmpty()) {
            return;
        }
        execute("removeFromTimelineEvents", () -> executor.removeFromTimelineEvents(personIds));
    }

    // ========== Persons ==========

    @Override
    public int deletePersons(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return run("deletePersons", () -> (int) executor.deletePersons(ids));
    }

    @Override
    public void updateCountsAndAliases(long personId, int documentCount, int connectionCount,
                                       List<String> aliases) {
        execute("updateCountsAndAliases",
                () -> executor.updateCountsAndAliases(personId, documentCount, connectionCount, aliases));
    }

    @Override
    public void updateCounts(long personId, int documentCount, int connectionCount) {
        execute("updateCounts", () -> executor.updateCounts(personId, documentCount, connectionCount));
    }

    // ========== Mapping ==========

    static Person mapPerson(Map<String, Object> row) {
        return Person.builder()
                .id(toLong(row.get("id")))
                .name(stringValue(row.get("name")))
                .aliases(toStringList(row.get("aliases")))
                .category((String) row.get("category"))
                .role((String) row.get("role"))
                .description((String) row.get("description"))
                .status(PersonStatus.fromValue((String) row.get("status")))
                .documentCount((int) toLong(row.get("documentCount")))
                .connectionCount((int) toLong(row.get("connectionCount")))
                .build();
    }

    private static long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            return Long.parseLong(s.trim());
        }
        return 0L;
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : "";
    }

    private static List<Long> toLongList(Object value) {
        List<Long> result = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            for (Object v : values) {
                result.add(toLong(v));
            }
        }
        return result;
    }

    private static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            for (Object v : values) {
                if (v != null) {
                    result.add(v.toString());
                }
            }
        }
        return result;
    }

    private <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("graph.store.failed operation={} error={}", operation, e.getMessage());
            throw new StoreException("Graph store operation failed: " + operation, e);
        }
    }

    private void execute(String operation, Runnable action) {
        run(operation, () -> {
            action.run();
            return null;
        });
    }
}
