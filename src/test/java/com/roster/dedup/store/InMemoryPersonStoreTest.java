package com.roster.dedup.store;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.core.model.TimelineEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryPersonStore Tests")
class InMemoryPersonStoreTest {

    private InMemoryPersonStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryPersonStore()
                .addPerson(person(1, "Glenn Dubin"))
                .addPerson(person(2, "Glen Dubin"))
                .addPerson(person(3, "Eva Dubin"));
    }

    private static Person person(long id, String name) {
        return Person.builder().id(id).name(name).build();
    }

    @Nested
    @DisplayName("Document links")
    class DocumentLinks {

        @Test
        @DisplayName("Reassigning then collapsing should keep one row per document, lowest id")
        void reassignAndCollapse() {
            store.addPersonDocument(new PersonDocument(10, 1, 100, null))
                    .addPersonDocument(new PersonDocument(11, 2, 100, "ctx"))
                    .addPersonDocument(new PersonDocument(12, 2, 200, null));

            store.reassignDocuments(List.of(2L), 1);
            int removed = store.deleteDuplicateDocumentLinks(1);

            assertEquals(1, removed);
            assertEquals(2, store.countDocumentLinks(1));
            assertEquals(0, store.countDocumentLinks(2));
            assertTrue(store.findAllPersonDocuments().stream().anyMatch(pd -> pd.id() == 10));
            assertTrue(store.findAllPersonDocuments().stream().noneMatch(pd -> pd.id() == 11));
        }

        @Test
        @DisplayName("Deleting links of persons should leave other links")
        void deleteLinks() {
            store.addPersonDocument(new PersonDocument(10, 1, 100, null))
                    .addPersonDocument(new PersonDocument(11, 2, 100, null));

            assertEquals(1, store.deleteDocumentLinks(List.of(2L, 99L)));
            assertEquals(1, store.findAllPersonDocuments().size());
        }
    }

    @Nested
    @DisplayName("Connections")
    class Connections {

        @Test
        @DisplayName("Reassigning both ends should produce a self-loop that can be swept")
        void reassignProducesSelfLoop() {
            store.addConnection(new Connection(1, 1, 2, "associate", null, 1))
                    .addConnection(new Connection(2, 3, 2, "family", null, 1));

            store.reassignConnections(List.of(2L), 1);

            assertEquals(1, store.deleteSelfLoopConnections());
            List<Connection> remaining = store.findAllConnections();
            assertEquals(1, remaining.size());
            assertTrue(remaining.get(0).involves(3));
            assertTrue(remaining.get(0).involves(1));
        }

        @Test
        @DisplayName("Parallel connections keep the longest description, then highest strength, then lowest id")
        void deleteDuplicateConnections() {
            store.addConnection(new Connection(5, 1, 3, "family", "short", 9))
                    .addConnection(new Connection(6, 3, 1, "family", "a longer description", 1))
                    .addConnection(new Connection(7, 1, 2, "associate", null, 2))
                    .addConnection(new Connection(8, 2, 1, "associate", null, 5))
                    .addConnection(new Connection(9, 3, 3, "self", null, 1));

            int removed = store.deleteDuplicateConnections();

            assertEquals(3, removed);
            Set<Long> ids = Set.copyOf(store.findAllConnections().stream().map(Connection::id).toList());
            assertEquals(Set.of(6L, 8L), ids);
        }

        @Test
        @DisplayName("Counting a person's connections covers both ends")
        void countConnections() {
            store.addConnection(new Connection(1, 1, 2, "associate", null, 1))
                    .addConnection(new Connection(2, 3, 1, "associate", null, 1));

            assertEquals(2, store.countConnections(1));
            assertEquals(1, store.deleteConnectionsReferencing(List.of(2L)));
        }
    }

    @Nested
    @DisplayName("Timeline events")
    class TimelineEvents {

        @Test
        @DisplayName("Replacing ids should dedupe the person list")
        void replaceDedupes() {
            store.addTimelineEvent(new TimelineEvent(1, "2005-03-01", "Flight", List.of(1L, 2L, 3L)));

            store.replaceInTimelineEvents(List.of(2L), 1);

            assertEquals(List.of(1L, 3L), store.findAllTimelineEvents().get(0).personIds());
        }

        @Test
        @DisplayName("Removing ids should drop them from every event")
        void removeIds() {
            store.addTimelineEvent(new TimelineEvent(1, "2005-03-01", "Flight", List.of(1L, 2L)))
                    .addTimelineEvent(new TimelineEvent(2, "2006-01-01", "Meeting", List.of(2L)));

            store.removeFromTimelineEvents(List.of(2L));

            assertEquals(List.of(1L), store.findAllTimelineEvents().get(0).personIds());
            assertEquals(List.of(), store.findAllTimelineEvents().get(1).personIds());
        }
    }

    @Nested
    @DisplayName("Persons")
    class Persons {

        @Test
        @DisplayName("Deleting persons should tolerate missing ids")
        void deleteTolerant() {
            assertEquals(1, store.deletePersons(List.of(2L, 2L, 42L)));
            assertEquals(2, store.countPersons());
            assertEquals(Set.of(1L), store.findExistingIds(List.of(1L, 2L, 42L)));
        }

        @Test
        @DisplayName("Updating counts and aliases should replace the person row")
        void updateCountsAndAliases() {
            store.updateCountsAndAliases(1, 4, 2, List.of("Glen Dubin"));

            Person updated = store.findPersonById(1).orElseThrow();
            assertEquals(4, updated.getDocumentCount());
            assertEquals(2, updated.getConnectionCount());
            assertEquals(List.of("Glen Dubin"), updated.getAliases());

            store.updateCounts(1, 0, 0);
            assertEquals(List.of("Glen Dubin"), store.findPersonById(1).orElseThrow().getAliases());
            assertDoesNotThrow(() -> store.updateCounts(42, 1, 1));
        }
    }
}
