package com.roster.dedup.store;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreSnapshotTest {

    @Mock
    private PersonStore failingStore;

    @Test
    @DisplayName("Snapshot should order persons by id and stay fixed while the store changes")
    void snapshotIsReadOnce() {
        InMemoryPersonStore store = new InMemoryPersonStore()
                .addPerson(Person.builder().id(3).name("Eva Dubin").build())
                .addPerson(Person.builder().id(1).name("Glenn Dubin").build())
                .addPersonDocument(new PersonDocument(1, 1, 100, null))
                .addConnection(new Connection(1, 1, 3, "family", null, 1));

        StoreSnapshot snapshot = StoreSnapshot.load(store);
        store.deletePersons(List.of(1L));

        assertEquals(List.of(1L, 3L), snapshot.persons().stream().map(Person::getId).toList());
        assertEquals(2, snapshot.personCount());
        assertTrue(snapshot.person(1).isPresent());
        assertTrue(snapshot.person(2).isEmpty());
        assertEquals(1, snapshot.personDocuments().size());
        assertEquals(1, snapshot.connections().size());
    }

    @Test
    @DisplayName("A failing store should abort the snapshot")
    void storeFailurePropagates() {
        when(failingStore.findAllPersons()).thenThrow(new StoreException("unreachable"));

        assertThrows(StoreException.class, () -> StoreSnapshot.load(failingStore));
    }
}
