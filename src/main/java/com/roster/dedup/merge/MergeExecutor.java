package com.roster.dedup.merge;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.logging.LogContext;
import com.roster.dedup.metrics.MetricsService;
import com.roster.dedup.metrics.NoOpMetricsService;
import com.roster.dedup.store.PersonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Merges a group of duplicate persons into a canonical person, cascading the change across
 * document links, connections and timeline events.
 *
 * <p>Merge process:</p>
 * <ol>
 *   <li>collect the new aliases</li>
 *   <li>repoint document links, then collapse duplicate (person, document) rows</li>
 *   <li>repoint connections, drop self-loops and any connection still touching a duplicate</li>
 *   <li>replace duplicate ids in timeline events</li>
 *   <li>drop document links still referencing duplicates</li>
 *   <li>delete the duplicate persons</li>
 *   <li>recount the canonical and persist its aliases</li>
 * </ol>
 * Re-running a merge whose duplicates are already gone is a no-op.
 */
public class MergeExecutor {
    private static final Logger log = LoggerFactory.getLogger(MergeExecutor.class);

    public static final int DEFAULT_ALIAS_CAP = 20;

    private final PersonStore store;
    private final int aliasCap;
    private final MetricsService metrics;

    public MergeExecutor(PersonStore store) {
        this(store, DEFAULT_ALIAS_CAP, new NoOpMetricsService());
    }

    public MergeExecutor(PersonStore store, int aliasCap, MetricsService metrics) {
        if (aliasCap < 0) {
            throw new IllegalArgumentException("aliasCap must be non-negative");
        }
        this.store = store;
        this.aliasCap = aliasCap;
        this.metrics = metrics;
    }

    /**
     * Merges {@code duplicateIds} into the canonical person.
     *
     * @param canonicalId  surviving person
     * @param duplicateIds persons to absorb; ids that no longer exist are ignored
     * @param allNames     candidate alias names, usually the names of the whole group
     */
    public MergeResult mergePersonGroup(long canonicalId, Collection<Long> duplicateIds, List<String> allNames) {
        try (LogContext ctx = LogContext.forMerge(canonicalId)) {

            Optional<Person> canonicalOpt = store.findPersonById(canonicalId);
            if (canonicalOpt.isEmpty()) {
                log.debug("merge.skipped canonicalId={} reason=canonical-missing", canonicalId);
                return MergeResult.noOp(canonicalId, "canonical no longer exists");
            }
            Person canonical = canonicalOpt.get();

            Set<Long> requested = new LinkedHashSet<>(duplicateIds);
            requested.remove(canonicalId);
            Set<Long> existing = store.findExistingIds(requested);
            List<Long> duplicates = new ArrayList<>();
            for (Long id : requested) {
                if (existing.contains(id)) {
                    duplicates.add(id);
                }
            }
            if (duplicates.isEmpty()) {
                log.debug("merge.skipped canonicalId={} reason=duplicates-missing", canonicalId);
                return MergeResult.noOp(canonicalId, "duplicates no longer exist");
            }

            log.debug("merge.starting canonicalId={} canonicalName='{}' duplicates={}",
                    canonicalId, canonical.getName(), duplicates);

            List<String> newAliases = newAliases(canonical, allNames);

            store.reassignDocuments(duplicates, canonicalId);
            int collapsedLinks = store.deleteDuplicateDocumentLinks(canonicalId);

            store.reassignConnections(duplicates, canonicalId);
            int selfLoops = store.deleteSelfLoopConnections();
            int stray = store.deleteConnectionsReferencing(duplicates);

            store.replaceInTimelineEvents(duplicates, canonicalId);

            store.deleteDocumentLinks(duplicates);
            int removed = store.deletePersons(duplicates);

            int documentCount = store.countDocumentLinks(canonicalId);
            int connectionCount = store.countConnections(canonicalId);
            List<String> aliases = new ArrayList<>(canonical.getAliases());
            aliases.removeIf(a -> a.equals(canonical.getName()));
            aliases.addAll(newAliases);
            store.updateCountsAndAliases(canonicalId, documentCount, connectionCount,
                    List.copyOf(new LinkedHashSet<>(aliases)));

            metrics.incrementPersonsMerged(removed);
            log.info("merge.completed canonicalId={} merged={} aliasesAdded={} collapsedLinks={} selfLoops={} "
                            + "strayConnections={} documentCount={} connectionCount={}",
                    canonicalId, removed, newAliases.size(), collapsedLinks, selfLoops, stray,
                    documentCount, connectionCount);
            return MergeResult.applied(canonicalId, duplicates, newAliases, documentCount, connectionCount);
        }
    }

    /**
     * Names other than the canonical's own that are not yet aliases, limited so the
     * canonical never holds more than the alias cap.
     */
    List<String> newAliases(Person canonical, List<String> allNames) {
        Set<String> existing = new LinkedHashSet<>(canonical.getAliases());
        existing.remove(canonical.getName());
        int room = Math.max(0, aliasCap - existing.size());
        List<String> added = new ArrayList<>();
        for (String name : allNames) {
            if (added.size() >= room) {
                break;
            }
            if (name == null || name.equals(canonical.getName()) || existing.contains(name) || added.contains(name)) {
                continue;
            }
            added.add(name);
        }
        return added;
    }
}
