package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonRef;
import com.roster.dedup.evidence.EvidenceIndex;
import com.roster.dedup.merge.CanonicalSelector;
import com.roster.dedup.merge.CascadeDeleter;
import com.roster.dedup.merge.MergeExecutor;
import com.roster.dedup.metrics.MetricsService;
import com.roster.dedup.metrics.NoOpMetricsService;
import com.roster.dedup.plan.DeduplicationAction;
import com.roster.dedup.rules.JunkNameClassifier;
import com.roster.dedup.rules.NameNormalizer;
import com.roster.dedup.rules.ProtectedNames;
import com.roster.dedup.store.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Run-local working view shared by all passes of one run.
 *
 * <p>Passes read persons from the snapshot taken at the start of the run. Every person deleted
 * or absorbed earlier in the run is retired from that view, whether the change was applied to
 * the store or only recorded as a plan action, so a dry-run proposes exactly what an apply run
 * would do. Evidence of absorbed persons is credited to their canonical.</p>
 *
 * <p>In dry-run mode {@link #delete} and {@link #merge} append pending actions; in apply mode
 * they mutate the store. Failures in apply mode are logged and the group is skipped.</p>
 */
public class PassContext {
    private static final Logger log = LoggerFactory.getLogger(PassContext.class);

    private final StoreSnapshot snapshot;
    private final EvidenceIndex evidence;
    private final ProtectedNames protectedNames;
    private final CanonicalSelector canonicalSelector;
    private final MergeExecutor mergeExecutor;
    private final CascadeDeleter cascadeDeleter;
    private final MetricsService metrics;
    private final boolean dryRun;

    private final NameNormalizer normalizer = NameNormalizer.getInstance();
    private final JunkNameClassifier junkClassifier = new JunkNameClassifier();
    private final List<DeduplicationAction> actions = new ArrayList<>();
    private final Set<Long> deleted = new HashSet<>();
    private final Map<Long, Long> absorbedInto = new HashMap<>();
    private final Map<Long, Set<Long>> absorbedBy = new HashMap<>();
    private Map<String, List<Person>> byLowerName;
    private int nextActionId = 1;
    private int failures;

    private PassContext(Builder builder) {
        this.snapshot = Objects.requireNonNull(builder.snapshot, "snapshot is required");
        this.evidence = builder.evidence != null ? builder.evidence : EvidenceIndex.build(snapshot);
        this.protectedNames = builder.protectedNames != null ? builder.protectedNames : ProtectedNames.empty();
        this.canonicalSelector = new CanonicalSelector(protectedNames);
        this.mergeExecutor = builder.mergeExecutor;
        this.cascadeDeleter = builder.cascadeDeleter;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.dryRun = builder.dryRun;
        if (!dryRun && (mergeExecutor == null || cascadeDeleter == null)) {
            throw new IllegalArgumentException("Apply mode requires a merge executor and a cascade deleter");
        }
    }

    // ========== Working view ==========

    /**
     * Persons not yet deleted or absorbed in this run, by ascending id.
     */
    public List<Person> livePersons() {
        return snapshot.persons().stream()
                .filter(p -> !isRetired(p.getId()))
                .toList();
    }

    public boolean isRetired(long personId) {
        return deleted.contains(personId) || absorbedInto.containsKey(personId);
    }

    /**
     * Live person whose raw name equals {@code name} ignoring case. An exact-case match wins,
     * otherwise the lowest id.
     */
    public Optional<Person> findLiveByNameIgnoreCase(String name) {
        if (byLowerName == null) {
            byLowerName = new HashMap<>();
            for (Person p : snapshot.persons()) {
                byLowerName.computeIfAbsent(p.getName().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(p);
            }
        }
        return byLowerName.getOrDefault(name.toLowerCase(Locale.ROOT), List.of()).stream()
                .filter(p -> !isRetired(p.getId()))
                .min(Comparator.comparing((Person p) -> !p.getName().equals(name))
                        .thenComparingLong(Person::getId));
    }

    /**
     * Documents linked to the person or to anyone absorbed into it during this run.
     */
    public Set<Long> documentsOf(long personId) {
        Set<Long> docs = new HashSet<>(evidence.documentsOf(personId));
        for (Long member : absorbedMembers(personId)) {
            docs.addAll(evidence.documentsOf(member));
        }
        return docs;
    }

    /**
     * Surviving persons connected to the person or to anyone absorbed into it, with absorbed
     * persons resolved to their canonical. Self-references are dropped.
     */
    public Set<Long> connectionsOf(long personId) {
        Set<Long> group = new HashSet<>(absorbedMembers(personId));
        group.add(personId);
        Set<Long> conns = new HashSet<>();
        for (Long member : group) {
            for (Long other : evidence.connectionsOf(member)) {
                resolve(other).filter(id -> id != personId).ifPresent(conns::add);
            }
        }
        return conns;
    }

    /**
     * Distinct documents plus distinct connected persons.
     */
    public int referenceTotal(long personId) {
        return documentsOf(personId).size() + connectionsOf(personId).size();
    }

    private Set<Long> absorbedMembers(long personId) {
        return absorbedBy.getOrDefault(personId, Set.of());
    }

    private Optional<Long> resolve(long personId) {
        long current = personId;
        while (absorbedInto.containsKey(current)) {
            current = absorbedInto.get(current);
        }
        return deleted.contains(current) ? Optional.empty() : Optional.of(current);
    }

    // ========== Actions ==========

    /**
     * Deletes the persons. A dry-run records one action per person.
     *
     * @return number of persons deleted or proposed for deletion
     */
    public int delete(int pass, String reason, List<Person> targets) {
        List<Person> live = targets.stream().filter(p -> !isRetired(p.getId())).distinct().toList();
        if (live.isEmpty()) {
            return 0;
        }
        if (dryRun) {
            for (Person target : live) {
                actions.add(DeduplicationAction.delete(nextActionId++, pass, reason, List.of(target.toRef())));
                metrics.incrementActionProposed(pass, "delete");
            }
        } else {
            try {
                cascadeDeleter.deletePersonsCascade(live.stream().map(Person::getId).toList());
            } catch (RuntimeException e) {
                failures++;
                metrics.incrementFailure("delete");
                log.warn("pass.delete.failed pass={} reason='{}' count={} error={}",
                        pass, reason, live.size(), e.getMessage(), e);
                return 0;
            }
        }
        for (Person target : live) {
            deleted.add(target.getId());
        }
        return live.size();
    }

    /**
     * Merges the duplicates into the canonical.
     *
     * @param aliasNames names offered as aliases; the executor drops the canonical's own name
     * @param evidence   optional evidence string recorded on the plan action
     * @return true if the merge was applied or proposed
     */
    public boolean merge(int pass, String reason, Person canonical, List<Person> duplicates,
                         List<String> aliasNames, String evidence) {
        if (isRetired(canonical.getId())) {
            return false;
        }
        List<Person> live = duplicates.stream()
                .filter(p -> p.getId() != canonical.getId() && !isRetired(p.getId()))
                .distinct()
                .toList();
        if (live.isEmpty()) {
            return false;
        }
        if (dryRun) {
            List<PersonRef> refs = live.stream().map(Person::toRef).toList();
            actions.add(DeduplicationAction.merge(nextActionId++, pass, reason, canonical.toRef(), refs, evidence));
            metrics.incrementActionProposed(pass, "merge");
        } else {
            try {
                mergeExecutor.mergePersonGroup(canonical.getId(),
                        live.stream().map(Person::getId).toList(), aliasNames);
            } catch (RuntimeException e) {
                failures++;
                metrics.incrementFailure("merge");
                log.warn("pass.merge.failed pass={} canonicalId={} canonical='{}' error={}",
                        pass, canonical.getId(), canonical.getName(), e.getMessage(), e);
                return false;
            }
        }
        Set<Long> members = absorbedBy.computeIfAbsent(canonical.getId(), k -> new LinkedHashSet<>());
        for (Person duplicate : live) {
            absorbedInto.put(duplicate.getId(), canonical.getId());
            members.add(duplicate.getId());
            Set<Long> inherited = absorbedBy.remove(duplicate.getId());
            if (inherited != null) {
                members.addAll(inherited);
            }
        }
        return true;
    }

    // ========== Accessors ==========

    public boolean isDryRun() {
        return dryRun;
    }

    public List<DeduplicationAction> getActions() {
        return List.copyOf(actions);
    }

    public int getFailures() {
        return failures;
    }

    public StoreSnapshot getSnapshot() {
        return snapshot;
    }

    public ProtectedNames getProtectedNames() {
        return protectedNames;
    }

    public boolean isProtected(Person person) {
        return protectedNames.isProtected(person.getName());
    }

    public CanonicalSelector getCanonicalSelector() {
        return canonicalSelector;
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    public JunkNameClassifier getJunkClassifier() {
        return junkClassifier;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StoreSnapshot snapshot;
        private EvidenceIndex evidence;
        private ProtectedNames protectedNames;
        private MergeExecutor mergeExecutor;
        private CascadeDeleter cascadeDeleter;
        private MetricsService metrics;
        private boolean dryRun;

        public Builder snapshot(StoreSnapshot snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        public Builder evidence(EvidenceIndex evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder protectedNames(ProtectedNames protectedNames) {
            this.protectedNames = protectedNames;
            return this;
        }

        public Builder mergeExecutor(MergeExecutor mergeExecutor) {
            this.mergeExecutor = mergeExecutor;
            return this;
        }

        public Builder cascadeDeleter(CascadeDeleter cascadeDeleter) {
            this.cascadeDeleter = cascadeDeleter;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public PassContext build() {
            return new PassContext(this);
        }
    }
}
