package com.roster.dedup.merge;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.core.model.TimelineEvent;
import com.roster.dedup.metrics.NoOpMetricsService;
import com.roster.dedup.store.InMemoryPersonStore;
import com.roster.dedup.store.PersonStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CascadeDeleter Tests")
class CascadeDeleterTest {

    @Mock
    private PersonStore mockStore;

    @Test
    @DisplayName("Should remove persons with their links, connections and timeline references")
    void cascades() {
        InMemoryPersonStore store = new InMemoryPersonStore()
                .addPerson(Person.builder().id(1).name("Unknown Male").build())
                .addPerson(Person.builder().id(2).name("Sarah Kellen").build())
                .addPersonDocument(new PersonDocument(10, 1, 100, null))
                .addPersonDocument(new PersonDocument(11, 2, 100, null))
                .addConnection(new Connection(20, 1, 2, "associate", null, 1))
                .addTimelineEvent(new TimelineEvent(30, "2002-01-01", "Flight", List.of(1L, 2L)));

        int removed = new CascadeDeleter(store).deletePersonsCascade(List.of(1L, 1L, 42L));

        assertEquals(1, removed);
        assertEquals(List.of(2L), store.findAllPersons().stream().map(Person::getId).toList());
        assertEquals(1, store.findAllPersonDocuments().size());
        assertTrue(store.findAllConnections().isEmpty());
        assertEquals(List.of(2L), store.findAllTimelineEvents().get(0).personIds());
    }

    @Test
    @DisplayName("Should delete in chunks")
    void chunks() {
        when(mockStore.deletePersons(anyCollection())).thenReturn(2, 2, 1);

        int removed = new CascadeDeleter(mockStore, 2, new NoOpMetricsService())
                .deletePersonsCascade(List.of(1L, 2L, 3L, 4L, 5L));

        assertEquals(5, removed);
        verify(mockStore, times(3)).deletePersons(anyCollection());
        verify(mockStore, times(3)).deleteConnectionsReferencing(anyCollection());
        verify(mockStore, times(3)).removeFromTimelineEvents(anyCollection());
    }

    @Test
    @DisplayName("Chunk size must be positive")
    void rejectsBadChunkSize() {
        assertThrows(IllegalArgumentException.class,
                () -> new CascadeDeleter(mockStore, 0, new NoOpMetricsService()));
    }
}
