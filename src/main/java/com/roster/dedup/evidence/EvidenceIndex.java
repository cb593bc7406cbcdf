package com.roster.dedup.evidence;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.store.StoreSnapshot;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Co-occurrence maps built once per run from the snapshot:
 * person to linked documents and person to connected persons.
 * Read-only after construction.
 */
public final class EvidenceIndex {

    private final Map<Long, Set<Long>> docsByPerson;
    private final Map<Long, Set<Long>> connsByPerson;

    private EvidenceIndex(Map<Long, Set<Long>> docsByPerson, Map<Long, Set<Long>> connsByPerson) {
        this.docsByPerson = docsByPerson;
        this.connsByPerson = connsByPerson;
    }

    public static EvidenceIndex build(StoreSnapshot snapshot) {
        Map<Long, Set<Long>> docs = new HashMap<>();
        for (PersonDocument pd : snapshot.personDocuments()) {
            docs.computeIfAbsent(pd.personId(), k -> new HashSet<>()).add(pd.documentId());
        }

        Map<Long, Set<Long>> conns = new HashMap<>();
        for (Connection c : snapshot.connections()) {
            conns.computeIfAbsent(c.personId1(), k -> new HashSet<>()).add(c.personId2());
            conns.computeIfAbsent(c.personId2(), k -> new HashSet<>()).add(c.personId1());
        }
        return new EvidenceIndex(docs, conns);
    }

    /**
     * Distinct documents linked to the person.
     */
    public Set<Long> documentsOf(long personId) {
        return Collections.unmodifiableSet(docsByPerson.getOrDefault(personId, Set.of()));
    }

    /**
     * Distinct persons connected to the person.
     */
    public Set<Long> connectionsOf(long personId) {
        return Collections.unmodifiableSet(connsByPerson.getOrDefault(personId, Set.of()));
    }
}
