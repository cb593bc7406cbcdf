package com.roster.dedup.store;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.core.model.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-once copy of the store taken at the start of a run and passed through the pipeline.
 * It is never refreshed while the run mutates the store.
 */
public final class StoreSnapshot {
    private static final Logger log = LoggerFactory.getLogger(StoreSnapshot.class);

    private final List<Person> persons;
    private final List<PersonDocument> personDocuments;
    private final List<Connection> connections;
    private final List<TimelineEvent> timelineEvents;
    private final Map<Long, Person> personsById;

    public StoreSnapshot(List<Person> persons,
                         List<PersonDocument> personDocuments,
                         List<Connection> connections,
                         List<TimelineEvent> timelineEvents) {
        this.persons = persons.stream()
                .sorted(Comparator.comparingLong(Person::getId))
                .toList();
        this.personDocuments = List.copyOf(personDocuments);
        this.connections = List.copyOf(connections);
        this.timelineEvents = List.copyOf(timelineEvents);
        Map<Long, Person> byId = new LinkedHashMap<>();
        for (Person person : this.persons) {
            byId.put(person.getId(), person);
        }
        this.personsById = byId;
    }

    /**
     * Reads all four tables from the store.
     *
     * @throws StoreException if the store cannot be read
     */
    public static StoreSnapshot load(PersonStore store) {
        StoreSnapshot snapshot = new StoreSnapshot(
                store.findAllPersons(),
                store.findAllPersonDocuments(),
                store.findAllConnections(),
                store.findAllTimelineEvents());
        log.info("snapshot.loaded persons={} personDocuments={} connections={} timelineEvents={}",
                snapshot.persons.size(), snapshot.personDocuments.size(),
                snapshot.connections.size(), snapshot.timelineEvents.size());
        return snapshot;
    }

    /**
     * Persons ordered by ascending id.
     */
    public List<Person> persons() {
        return persons;
    }

    public List<PersonDocument> personDocuments() {
        return personDocuments;
    }

    public List<Connection> connections() {
        return connections;
    }

    public List<TimelineEvent> timelineEvents() {
        return timelineEvents;
    }

    public Optional<Person> person(long id) {
        return Optional.ofNullable(personsById.get(id));
    }

    public int personCount() {
        return persons.size();
    }
}
