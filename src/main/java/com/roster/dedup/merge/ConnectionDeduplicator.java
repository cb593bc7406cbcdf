package com.roster.dedup.merge;

import com.roster.dedup.store.PersonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store-wide connection maintenance: parallel connections between the same pair and self-loops.
 */
public class ConnectionDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(ConnectionDeduplicator.class);

    private final PersonStore store;

    public ConnectionDeduplicator(PersonStore store) {
        this.store = store;
    }

    /**
     * Keeps one connection per unordered pair (longest description, then highest strength,
     * then lowest id) and removes self-loops.
     *
     * @return number of connections removed
     */
    public int dedupConnections() {
        int removed = store.deleteDuplicateConnections();
        log.info("connections.deduplicated removed={}", removed);
        return removed;
    }

    /**
     * @return number of self-loops removed
     */
    public int sweepSelfLoops() {
        int removed = store.deleteSelfLoopConnections();
        if (removed > 0) {
            log.info("connections.selfLoops.removed count={}", removed);
        }
        return removed;
    }
}
