package com.roster.dedup.store;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.core.model.TimelineEvent;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Queryable store holding the four entity tables the deduplication engine reads and mutates.
 * Implementations provide different backends (in-memory, graph DB).
 *
 * <p>Every method may throw {@link StoreException}. Bulk mutators take id collections and
 * must tolerate ids that no longer exist.</p>
 */
public interface PersonStore {

    // ========== Bulk reads ==========

    List<Person> findAllPersons();

    List<PersonDocument> findAllPersonDocuments();

    List<Connection> findAllConnections();

    List<TimelineEvent> findAllTimelineEvents();

    // ========== Point reads ==========

    long countPersons();

    Optional<Person> findPersonById(long id);

    /**
     * Returns the subset of {@code ids} that still exist as persons.
     */
    Set<Long> findExistingIds(Collection<Long> ids);

    int countDocumentLinks(long personId);

    int countConnections(long personId);

    // ========== Person-document links ==========

    /**
     * Repoints every link of {@code fromIds} to {@code toId}.
     */
    void reassignDocuments(Collection<Long> fromIds, long toId);

    /**
     * Collapses duplicate (personId, documentId) rows of a person, keeping the lowest row id.
     *
     * @return number of rows removed
     */
    int deleteDuplicateDocumentLinks(long personId);

    /**
     * @return number of rows removed
     */
    int deleteDocumentLinks(Collection<Long> personIds);

    // ========== Connections ==========

    /**
     * Repoints both ends of every connection touching {@code fromIds} to {@code toId}.
     */
    void reassignConnections(Collection<Long> fromIds, long toId);

    /**
     * @return number of self-loop connections removed
     */
    int deleteSelfLoopConnections();

    /**
     * @return number of connections removed
     */
    int deleteConnectionsReferencing(Collection<Long> personIds);

    /**
     * Keeps one connection per unordered person pair, preferring the longest description,
     * then the highest strength, then the lowest id.
     *
     * @return number of connections removed
     */
    int deleteDuplicateConnections();

    // ========== Timeline events ==========

    /**
     * Replaces every id of {@code fromIds} with {@code toId} inside event person lists,
     * then removes duplicate ids from the affected lists.
     */
    void replaceInTimelineEvents(Collection<Long> fromIds, long toId);

    void removeFromTimelineEvents(Collection<Long> personIds);

    // ========== Persons ==========

    /**
     * @return number of persons removed
     */
    int deletePersons(Collection<Long> ids);

    void updateCountsAndAliases(long personId, int documentCount, int connectionCount, List<String> aliases);

    void updateCounts(long personId, int documentCount, int connectionCount);
}
