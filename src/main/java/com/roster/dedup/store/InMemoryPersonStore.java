package com.roster.dedup.store;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.core.model.TimelineEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of {@link PersonStore}.
 * Thread-safe via method-level synchronization. Used for tests and for offline runs
 * over exported tables.
 */
public class InMemoryPersonStore implements PersonStore {

    private static final Comparator<Connection> BEST_CONNECTION_FIRST =
            Comparator.<Connection>comparingInt(c -> c.description() != null ? c.description().length() : 0)
                    .reversed()
                    .thenComparing(Comparator.comparingInt(Connection::strength).reversed())
                    .thenComparingLong(Connection::id);

    private final Map<Long, Person> persons = new LinkedHashMap<>();
    private final List<PersonDocument> personDocuments = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final Map<Long, TimelineEvent> timelineEvents = new LinkedHashMap<>();

    // ========== Seeding ==========

    public synchronized InMemoryPersonStore addPerson(Person person) {
        persons.put(person.getId(), person);
        return this;
    }

    public synchronized InMemoryPersonStore addPersonDocument(PersonDocument link) {
        personDocuments.add(link);
        return this;
    }

    public synchronized InMemoryPersonStore addConnection(Connection connection) {
        connections.add(connection);
        return this;
    }

    public synchronized InMemoryPersonStore addTimelineEvent(TimelineEvent event) {
        timelineEvents.put(event.id(), event);
        return this;
    }

    // ========== Bulk reads ==========

    @Override
    public synchronized List<Person> findAllPersons() {
        return List.copyOf(persons.values());
    }

    @Override
    public synchronized List<PersonDocument> findAllPersonDocuments() {
        return List.copyOf(personDocuments);
    }

    @Override
    public synchronized List<Connection> findAllConnections() {
        return List.copyOf(connections);
    }

    @Override
    public synchronized List<TimelineEvent> findAllTimelineEvents() {
        return List.copyOf(timelineEvents.values());
    }

    // ========== Point reads ==========

    @Override
    public synchronized long countPersons() {
        return persons.size();
    }

    @Override
    public synchronized Optional<Person> findPersonById(long id) {
        return Optional.ofNullable(persons.get(id));
    }

    @Override
    public synchronized Set<Long> findExistingIds(Collection<Long> ids) {
        Set<Long> existing = new HashSet<>();
        for (Long id : ids) {
            if (persons.containsKey(id)) {
                existing.add(id);
            }
        }
        return existing;
    }

    @Override
    public synchronized int countDocumentLinks(long personId) {
        return (int) personDocuments.stream().filter(pd -> pd.personId() == personId).count();
    }

    @Override
    public synchronized int countConnections(long personId) {
        return (int) connections.stream().filter(c -> c.involves(personId)).count();
    }

    // ========== Person-document links ==========

    @Override
    public synchronized void reassignDocuments(Collection<Long> fromIds, long toId) {
        Set<Long> from = new HashSet<>(fromIds);
        personDocuments.replaceAll(pd -> from.contains(pd.personId()) ? pd.withPersonId(toId) : pd);
    }

    @Override
    public synchronized int deleteDuplicateDocumentLinks(long personId) {
        Map<Long, PersonDocument> keepByDocument = new HashMap<>();
        for (PersonDocument pd : personDocuments) {
            if (pd.personId() != personId) {
                continue;
            }
            keepByDocument.merge(pd.documentId(), pd, (a, b) -> a.id() <= b.id() ? a : b);
        }
        int before = personDocuments.size();
        personDocuments.removeIf(pd -> pd.personId() == personId
                && keepByDocument.get(pd.documentId()) != pd);
        return before - personDocuments.size();
    }

    @Override
    public synchronized int deleteDocumentLinks(Collection<Long> personIds) {
        Set<Long> ids = new HashSet<>(personIds);
        int before = personDocuments.size();
        personDocuments.removeIf(pd -> ids.contains(pd.personId()));
        return before - personDocuments.size();
    }

    // ========== Connections ==========

    @Override
    public synchronized void reassignConnections(Collection<Long> fromIds, long toId) {
        for (Long from : fromIds) {
            connections.replaceAll(c -> c.involves(from) ? c.reassign(from, toId) : c);
        }
    }

    @Override
    public synchronized int deleteSelfLoopConnections() {
        int before = connections.size();
        connections.removeIf(Connection::isSelfLoop);
        return before - connections.size();
    }

    @Override
    public synchronized int deleteConnectionsReferencing(Collection<Long> personIds) {
        Set<Long> ids = new HashSet<>(personIds);
        int before = connections.size();
        connections.removeIf(c -> ids.contains(c.personId1()) || ids.contains(c.personId2()));
        return before - connections.size();
    }

    @Override
    public synchronized int deleteDuplicateConnections() {
        Map<Connection.PairKey, Connection> best = new HashMap<>();
        for (Connection c : connections) {
            best.merge(c.pairKey(), c, (a, b) -> BEST_CONNECTION_FIRST.compare(a, b) <= 0 ? a : b);
        }
        int before = connections.size();
        connections.removeIf(c -> best.get(c.pairKey()) != c || c.isSelfLoop());
        return before - connections.size();
    }

    // ========== Timeline events ==========

    @Override
    public synchronized void replaceInTimelineEvents(Collection<Long> fromIds, long toId) {
        for (Long from : fromIds) {
            timelineEvents.replaceAll((id, event) -> event.references(from) ? event.replacePerson(from, toId) : event);
        }
    }

    @Override
    public synchronized void removeFromTimelineEvents(Collection<Long> personIds) {
        Set<Long> ids = new HashSet<>(personIds);
        timelineEvents.replaceAll((id, event) -> event.withoutPersons(ids));
    }

    // ========== Persons ==========

    @Override
    public synchronized int deletePersons(Collection<Long> ids) {
        int removed = 0;
        for (Long id : new HashSet<>(ids)) {
            if (persons.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized void updateCountsAndAliases(long personId, int documentCount, int connectionCount,
                                                    List<String> aliases) {
        Person person = persons.get(personId);
        if (person == null) {
            return;
        }
        persons.put(personId, Person.builder(person)
                .documentCount(documentCount)
                .connectionCount(connectionCount)
                .aliases(aliases)
                .build());
    }

    @Override
    public synchronized void updateCounts(long personId, int documentCount, int connectionCount) {
        Person person = persons.get(personId);
        if (person == null) {
            return;
        }
        persons.put(personId, Person.builder(person)
                .documentCount(documentCount)
                .connectionCount(connectionCount)
                .build());
    }
}
