package com.roster.dedup.merge;

import com.roster.dedup.metrics.MetricsService;
import com.roster.dedup.metrics.NoOpMetricsService;
import com.roster.dedup.store.PersonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Deletes persons together with their connections, document links and timeline references.
 * Identity is discarded, not merged: no aliases survive.
 */
public class CascadeDeleter {
    private static final Logger log = LoggerFactory.getLogger(CascadeDeleter.class);

    public static final int DEFAULT_CHUNK_SIZE = 500;

    private final PersonStore store;
    private final int chunkSize;
    private final MetricsService metrics;

    public CascadeDeleter(PersonStore store) {
        this(store, DEFAULT_CHUNK_SIZE, new NoOpMetricsService());
    }

    public CascadeDeleter(PersonStore store, int chunkSize, MetricsService metrics) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.store = store;
        this.chunkSize = chunkSize;
        this.metrics = metrics;
    }

    /**
     * @return number of person rows removed
     */
    public int deletePersonsCascade(Collection<Long> ids) {
        List<Long> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        int removed = 0;
        for (int from = 0; from < distinct.size(); from += chunkSize) {
            List<Long> chunk = distinct.subList(from, Math.min(from + chunkSize, distinct.size()));
            int connections = store.deleteConnectionsReferencing(chunk);
            int links = store.deleteDocumentLinks(chunk);
            store.removeFromTimelineEvents(chunk);
            int persons = store.deletePersons(chunk);
            removed += persons;
            log.debug("cascade.chunk.deleted persons={} connections={} documentLinks={}",
                    persons, connections, links);
        }
        if (removed > 0) {
            metrics.incrementPersonsDeleted(removed);
        }
        log.info("cascade.completed requested={} removed={}", distinct.size(), removed);
        return removed;
    }
}
