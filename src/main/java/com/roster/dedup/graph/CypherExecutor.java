package com.roster.dedup.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the Cypher statements backing the person store.
 *
 * <p>Graph model:</p>
 * <pre>
 * (:Person {id, name, aliases, category, role, description, status, documentCount, connectionCount})
 * (:Person)-[:MENTIONED_IN {id, context}]-&gt;(:Document {id})
 * (:Person)-[:CONNECTED_TO {id, connectionType, description, strength}]-&gt;(:Person)
 * (:TimelineEvent {id, date, title, personIds})
 * </pre>
 * Relationship endpoints cannot be moved in Cypher, so reassignment copies the relationship
 * onto the new endpoint and deletes the original.
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    // ========== Bulk reads ==========

    public List<Map<String, Object>> findAllPersons() {
        String query = """
                MATCH (p:Person)
                RETURN p.id as id, p.name as name, p.aliases as aliases, p.category as category,
                       p.role as role, p.description as description, p.status as status,
                       p.documentCount as documentCount, p.connectionCount as connectionCount
                ORDER BY p.id
                """;
        return connection.query(query);
    }

    public List<Map<String, Object>> findAllPersonDocuments() {
        String query = """
                MATCH (p:Person)-[m:MENTIONED_IN]->(d:Document)
                RETURN m.id as id, p.id as personId, d.id as documentId, m.context as context
                ORDER BY m.id
                """;
        return connection.query(query);
    }

    public List<Map<String, Object>> findAllConnections() {
        String query = """
                MATCH (a:Person)-[r:CONNECTED_TO]->(b:Person)
                RETURN r.id as id, a.id as personId1, b.id as personId2,
                       r.connectionType as connectionType, r.description as description,
                       r.strength as strength
                ORDER BY r.id
                """;
        return connection.query(query);
    }

    public List<Map<String, Object>> findAllTimelineEvents() {
        String query = """
                MATCH (t:TimelineEvent)
                RETURN t.id as id, t.date as date, t.title as title, t.personIds as personIds
                ORDER BY t.id
                """;
        return connection.query(query);
    }

    // ========== Point reads ==========

    public long countPersons() {
        String query = """
                MATCH (p:Person)
                RETURN count(p) as total
                """;
        return singleLong(connection.query(query), "total");
    }

    public List<Map<String, Object>> findPersonById(long id) {
        String query = """
                MATCH (p:Person {id: $id})
                RETURN p.id as id, p.name as name, p.aliases as aliases, p.category as category,
                       p.role as role, p.description as description, p.status as status,
                       p.documentCount as documentCount, p.connectionCount as connectionCount
                """;
        return connection.query(query, Map.of("id", id));
    }

    public List<Map<String, Object>> findExistingIds(Collection<Long> ids) {
        String query = """
                MATCH (p:Person)
                WHERE p.id IN $ids
                RETURN p.id as id
                """;
        return connection.query(query, Map.of("ids", List.copyOf(ids)));
    }

    public long countDocumentLinks(long personId) {
        String query = """
                MATCH (p:Person {id: $personId})-[m:MENTIONED_IN]->(:Document)
                RETURN count(m) as total
                """;
        return singleLong(connection.query(query, Map.of("personId", personId)), "total");
    }

    public long countConnections(long personId) {
        String query = """
                MATCH (p:Person {id: $personId})-[r:CONNECTED_TO]-(:Person)
                RETURN count(DISTINCT r) as total
                """;
        return singleLong(connection.query(query, Map.of("personId", personId)), "total");
    }

    // ========== Person-document links ==========

    public void reassignDocuments(Collection<Long> fromIds, long toId) {
        String query = """
                MATCH (dup:Person)-[m:MENTIONED_IN]->(d:Document)
                WHERE dup.id IN $fromIds
                MATCH (c:Person {id: $toId})
                CREATE (c)-[:MENTIONED_IN {id: m.id, context: m.context}]->(d)
                DELETE m
                """;
        connection.execute(query, Map.of("fromIds", List.copyOf(fromIds), "toId", toId));
        log.debug("graph.documents.reassigned from={} to={}", fromIds, toId);
    }

    public long deleteDuplicateDocumentLinks(long personId) {
        String query = """
                MATCH (p:Person {id: $personId})-[m:MENTIONED_IN]->(d:Document)
                WITH d, m ORDER BY m.id
                WITH d, collect(m) as links
                WHERE size(links) > 1
                UNWIND links[1..] as extra
                DELETE extra
                RETURN count(extra) as removed
                """;
        return singleLong(connection.query(query, Map.of("personId", personId)), "removed");
    }

    public long deleteDocumentLinks(Collection<Long> personIds) {
        String query = """
                MATCH (p:Person)-[m:MENTIONED_IN]->(:Document)
                WHERE p.id IN $personIds
                DELETE m
                RETURN count(m) as removed
                """;
        return singleLong(connection.query(query, Map.of("personIds", List.copyOf(personIds))), "removed");
    }

    // ========== Connections ==========

    public void reassignConnections(Collection<Long> fromIds, long toId) {
        Map<String, Object> params = Map.of("fromIds", List.copyOf(fromIds), "toId", toId);
        String outgoing = """
                MATCH (dup:Person)-[r:CONNECTED_TO]->(other:Person)
                WHERE dup.id IN $fromIds
                MATCH (c:Person {id: $toId})
                CREATE (c)-[:CONNECTED_TO {id: r.id, connectionType: r.connectionType,
                        description: r.description, strength: r.strength}]->(other)
                DELETE r
                """;
        String incoming = """
                MATCH (other:Person)-[r:CONNECTED_TO]->(dup:Person)
                WHERE dup.id IN $fromIds
                MATCH (c:Person {id: $toId})
                CREATE (other)-[:CONNECTED_TO {id: r.id, connectionType: r.connectionType,
                        description: r.description, strength: r.strength}]->(c)
                DELETE r
                """;
        connection.execute(outgoing, params);
        connection.execute(incoming, params);
        log.debug("graph.connections.reassigned from={} to={}", fromIds, toId);
    }

    public long deleteSelfLoopConnections() {
        String query = """
                MATCH (p:Person)-[r:CONNECTED_TO]->(p)
                DELETE r
                RETURN count(r) as removed
                """;
        return singleLong(connection.query(query), "removed");
    }

    public long deleteConnectionsReferencing(Collection<Long> personIds) {
        String query = """
                MATCH (p:Person)-[r:CONNECTED_TO]-(:Person)
                WHERE p.id IN $personIds
                WITH DISTINCT r
                DELETE r
                RETURN count(r) as removed
                """;
        return singleLong(connection.query(query, Map.of("personIds", List.copyOf(personIds))), "removed");
    }

    /**
     * Keeps one connection per unordered pair: longest description, then highest strength,
     * then lowest id.
     */
    public long deleteDuplicateConnections() {
        String query = """
                MATCH (a:Person)-[r:CONNECTED_TO]-(b:Person)
                WHERE a.id < b.id
                WITH a, b, r
                ORDER BY size(coalesce(r.description, '')) DESC, r.strength DESC, r.id ASC
                WITH a, b, collect(DISTINCT r) as rels
                WHERE size(rels) > 1
                UNWIND rels[1..] as extra
                DELETE extra
                RETURN count(extra) as removed
                """;
        return singleLong(connection.query(query), "removed");
    }

    // ========== Timeline events ==========

    public void replaceInTimelineEvents(long fromId, long toId) {
        String query = """
                MATCH (t:TimelineEvent)
                WHERE $fromId IN t.personIds
                WITH t, [x IN t.personIds | CASE WHEN x = $fromId THEN $toId ELSE x END] as replaced
                SET t.personIds = reduce(acc = [], x IN replaced | CASE WHEN x IN acc THEN acc ELSE acc + x END)
                """;
        connection.execute(query, Map.of("fromId", fromId, "toId", toId));
    }

    public void removeFromTimelineEvents(Collection<Long> personIds) {
        String query = """
                MATCH (t:TimelineEvent)
                WHERE any(x IN t.personIds WHERE x IN $personIds)
                SET t.personIds = [x IN t.personIds WHERE NOT x IN $personIds]
                """;
        connection.execute(query, Map.of("personIds", List.copyOf(personIds)));
    }

    // ========== Persons ==========

    public long deletePersons(Collection<Long> ids) {
        String query = """
                MATCH (p:Person)
                WHERE p.id IN $ids
                WITH p, p.id as id
                DETACH DELETE p
                RETURN count(id) as removed
                """;
        return singleLong(connection.query(query, Map.of("ids", List.copyOf(ids))), "removed");
    }

    public void updateCounts(long personId, int documentCount, int connectionCount) {
        String query = """
                MATCH (p:Person {id: $personId})
                SET p.documentCount = $documentCount, p.connectionCount = $connectionCount
                """;
        connection.execute(query, Map.of(
                "personId", personId,
                "documentCount", documentCount,
                "connectionCount", connectionCount
        ));
    }

    public void updateCountsAndAliases(long personId, int documentCount, int connectionCount,
                                       List<String> aliases) {
        String query = """
                MATCH (p:Person {id: $personId})
                SET p.documentCount = $documentCount, p.connectionCount = $connectionCount,
                    p.aliases = $aliases
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("personId", personId);
        params.put("documentCount", documentCount);
        params.put("connectionCount", connectionCount);
        params.put("aliases", InputSanitizer.sanitizeAll(aliases));
        connection.execute(query, params);
    }

    private static long singleLong(List<Map<String, Object>> rows, String column) {
        if (rows.isEmpty()) {
            return 0L;
        }
        Object value = rows.get(0).get(column);
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
