package com.roster.dedup.pass;

import com.roster.dedup.core.model.Connection;
import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.merge.CascadeDeleter;
import com.roster.dedup.merge.MergeExecutor;
import com.roster.dedup.metrics.MetricsService;
import com.roster.dedup.metrics.NoOpMetricsService;
import com.roster.dedup.rules.ProtectedNames;
import com.roster.dedup.store.InMemoryPersonStore;
import com.roster.dedup.store.StoreSnapshot;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds small rosters and pass contexts over an {@link InMemoryPersonStore}.
 */
final class PassFixtures {

    private final InMemoryPersonStore store = new InMemoryPersonStore();
    private final AtomicLong linkIds = new AtomicLong(1000);
    private final AtomicLong connectionIds = new AtomicLong(5000);
    private ProtectedNames protectedNames = ProtectedNames.empty();

    PassFixtures person(long id, String name) {
        store.addPerson(Person.builder().id(id).name(name).build());
        return this;
    }

    /**
     * Links the person to each document.
     */
    PassFixtures documents(long personId, long... documentIds) {
        for (long documentId : documentIds) {
            store.addPersonDocument(new PersonDocument(linkIds.getAndIncrement(), personId, documentId, null));
        }
        return this;
    }

    PassFixtures connect(long personId1, long personId2) {
        store.addConnection(new Connection(connectionIds.getAndIncrement(), personId1, personId2,
                "associate", null, 1));
        return this;
    }

    PassFixtures protect(String... names) {
        protectedNames = ProtectedNames.of(List.of(names));
        return this;
    }

    InMemoryPersonStore store() {
        return store;
    }

    PassContext dryRun() {
        return PassContext.builder()
                .snapshot(StoreSnapshot.load(store))
                .protectedNames(protectedNames)
                .dryRun(true)
                .build();
    }

    PassContext apply() {
        return apply(new MergeExecutor(store), new CascadeDeleter(store), new NoOpMetricsService());
    }

    PassContext apply(MergeExecutor mergeExecutor, CascadeDeleter cascadeDeleter, MetricsService metrics) {
        return PassContext.builder()
                .snapshot(StoreSnapshot.load(store))
                .protectedNames(protectedNames)
                .mergeExecutor(mergeExecutor)
                .cascadeDeleter(cascadeDeleter)
                .metrics(metrics)
                .dryRun(false)
                .build();
    }

    List<Long> personIds() {
        return store.findAllPersons().stream().map(Person::getId).sorted().toList();
    }
}
