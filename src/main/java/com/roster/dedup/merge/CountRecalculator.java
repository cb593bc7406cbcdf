package com.roster.dedup.merge;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.store.PersonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Recomputes every person's derived document and connection counts from the link tables.
 */
public class CountRecalculator {
    private static final Logger log = LoggerFactory.getLogger(CountRecalculator.class);

    private final PersonStore store;

    public CountRecalculator(PersonStore store) {
        this.store = store;
    }

    /**
     * @return number of persons whose counts changed
     */
    public int recount() {
        Map<Long, Integer> documents = new HashMap<>();
        for (PersonDocument pd : store.findAllPersonDocuments()) {
            documents.merge(pd.personId(), 1, Integer::sum);
        }
        Map<Long, Integer> connections = new HashMap<>();
        for (Connection c : store.findAllConnections()) {
            connections.merge(c.personId1(), 1, Integer::sum);
            if (!c.isSelfLoop()) {
                connections.merge(c.personId2(), 1, Integer::sum);
            }
        }

        int updated = 0;
        for (Person person : store.findAllPersons()) {
            int docCount = documents.getOrDefault(person.getId(), 0);
            int connCount = connections.getOrDefault(person.getId(), 0);
            if (docCount != person.getDocumentCount() || connCount != person.getConnectionCount()) {
                store.updateCounts(person.getId(), docCount, connCount);
                updated++;
            }
        }
        log.info("counts.recalculated updated={}", updated);
        return updated;
    }
}
