package com.roster.dedup.core.model;

/**
 * Undirected relationship between two persons.
 * Canonically keyed by (min(personId1, personId2), max(personId1, personId2)).
 */
public record Connection(
        long id,
        long personId1,
        long personId2,
        String connectionType,
        String description,
        int strength
) {

    public boolean isSelfLoop() {
        return personId1 == personId2;
    }

    public boolean involves(long personId) {
        return personId1 == personId || personId2 == personId;
    }

    /**
     * Returns the other end of the connection, or {@code personId} itself for a self-loop.
     */
    public long otherEnd(long personId) {
        return personId1 == personId ? personId2 : personId1;
    }

    /**
     * Unordered pair key used to detect parallel connections.
     */
    public PairKey pairKey() {
        return new PairKey(Math.min(personId1, personId2), Math.max(personId1, personId2));
    }

    /**
     * Returns a copy with every occurrence of {@code from} replaced by {@code to}.
     */
    public Connection reassign(long from, long to) {
        long p1 = personId1 == from ? to : personId1;
        long p2 = personId2 == from ? to : personId2;
        return new Connection(id, p1, p2, connectionType, description, strength);
    }

    public record PairKey(long low, long high) {}
}
