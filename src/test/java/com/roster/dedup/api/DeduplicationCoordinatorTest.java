package com.roster.dedup.api;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonDocument;
import com.roster.dedup.plan.ActionStatus;
import com.roster.dedup.plan.CancellationToken;
import com.roster.dedup.plan.DeduplicationPlan;
import com.roster.dedup.plan.ExecutionResult;
import com.roster.dedup.plan.JsonPlanStore;
import com.roster.dedup.rules.ProtectedNames;
import com.roster.dedup.rules.VariantRule;
import com.roster.dedup.rules.VariantRuleSet;
import com.roster.dedup.store.InMemoryPersonStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeduplicationCoordinator")
class DeduplicationCoordinatorTest {

    private static final VariantRuleSet KEY_FIGURES = new VariantRuleSet("test", List.of(
            new VariantRule("Glenn Dubin", List.of("Glen Dubin"))));
    private static final VariantRuleSet OCR = new VariantRuleSet("test", List.of(
            new VariantRule("Bill Clinton", List.of("Billl Clinton"))));

    @TempDir
    Path dir;

    /**
     * One person per pass: each of passes 0 to 6 finds exactly one change.
     */
    private static InMemoryPersonStore roster() {
        InMemoryPersonStore store = new InMemoryPersonStore();
        person(store, 1, "AUSA");
        person(store, 2, "Ghislaine Maxwell");
        person(store, 3, "GHISLAINE MAXWELL");
        person(store, 4, "Dubin");
        person(store, 5, "Glenn Dubin");
        person(store, 6, "Eva Dubin");
        person(store, 7, "Kellen");
        person(store, 8, "John Smith");
        person(store, 9, "John Quincy Smith");
        person(store, 10, "Glen Dubin");
        person(store, 11, "Bill Clinton");
        person(store, 12, "Billl Clinton");
        long link = 100;
        for (long doc = 500; doc < 503; doc++) {
            store.addPersonDocument(new PersonDocument(link++, 4, doc, null));
            store.addPersonDocument(new PersonDocument(link++, 5, doc, null));
        }
        store.addPersonDocument(new PersonDocument(link, 9, 600, null));
        return store;
    }

    private static void person(InMemoryPersonStore store, long id, String name) {
        store.addPerson(Person.builder().id(id).name(name).build());
    }

    private DeduplicationCoordinator coordinator(InMemoryPersonStore store, ProtectedNames protectedNames) {
        return DeduplicationCoordinator.builder()
                .store(store)
                .protectedNames(protectedNames)
                .keyFigures(KEY_FIGURES)
                .ocrNicknames(OCR)
                .planStore(new JsonPlanStore(dir.resolve("plan.json")))
                .build();
    }

    private DeduplicationCoordinator coordinator(InMemoryPersonStore store) {
        return coordinator(store, ProtectedNames.empty());
    }

    private static Map<Long, List<String>> survivors(InMemoryPersonStore store) {
        Map<Long, List<String>> result = new TreeMap<>();
        for (Person person : store.findAllPersons()) {
            result.put(person.getId(), person.getAliases());
        }
        return result;
    }

    @Nested
    @DisplayName("Dry-run")
    class DryRun {

        @Test
        @DisplayName("Should propose one action per pass without touching the store")
        void proposesWithoutMutation() {
            InMemoryPersonStore store = roster();

            DeduplicationReport report = coordinator(store).dryRun();

            assertEquals(DeduplicationMode.DRY_RUN, report.mode());
            assertEquals(12, report.personCountBefore());
            assertEquals(12, report.personCountAfter());
            assertEquals(12, store.countPersons());
            assertEquals(7, report.passes().size());
            for (int pass = 0; pass <= 6; pass++) {
                assertEquals(1, report.pass(pass).orElseThrow().changes(), "pass " + pass);
            }
            DeduplicationPlan plan = report.plan().orElseThrow();
            assertEquals(7, plan.getActions().size());
            assertEquals(7, plan.getSummary().byPass().size());
        }

        @Test
        @DisplayName("The written plan should be readable back with every action pending")
        void writesPlan() {
            InMemoryPersonStore store = roster();
            DeduplicationCoordinator coordinator = coordinator(store);

            coordinator.dryRun();

            DeduplicationPlan loaded = coordinator.getPlanStore().load();
            assertEquals(12, loaded.getPersonCountBefore());
            assertEquals(7, loaded.countByStatus(ActionStatus.PENDING));
        }

        @Test
        @DisplayName("Protected names should never be proposed for deletion")
        void protectedNamesRespected() {
            DeduplicationReport report = coordinator(roster(), ProtectedNames.of(List.of("Kellen"))).dryRun();

            assertEquals(0, report.pass(3).orElseThrow().changes());
        }
    }

    @Nested
    @DisplayName("Apply and execute-plan")
    class ApplyAndExecute {

        @Test
        @DisplayName("Executing a dry-run plan should give the same roster as apply")
        void dryRunThenExecuteMatchesApply() {
            InMemoryPersonStore planned = roster();
            InMemoryPersonStore applied = roster();
            DeduplicationCoordinator plannedCoordinator = coordinator(planned);

            plannedCoordinator.dryRun();
            ExecutionResult result = plannedCoordinator.executePlan(new CancellationToken());
            coordinator(applied).apply();

            assertEquals(7, result.executed());
            assertEquals(0, result.failed());
            assertEquals(List.of(2L, 5L, 6L, 9L, 11L), List.copyOf(survivors(planned).keySet()));
            assertEquals(survivors(applied), survivors(planned));
            assertEquals(List.of("Dubin", "Glen Dubin"), survivors(applied).get(5L));
        }

        @Test
        @DisplayName("A second apply should find nothing to do")
        void applyIsIdempotent() {
            InMemoryPersonStore store = roster();
            DeduplicationCoordinator coordinator = coordinator(store);

            DeduplicationReport first = coordinator.apply();
            DeduplicationReport second = coordinator.apply();

            assertEquals(7, first.totalChanges());
            assertEquals(5, first.personCountAfter());
            assertEquals(0, second.totalChanges());
            assertEquals(5, second.personCountAfter());
            assertTrue(second.plan().isEmpty());
        }

        @Test
        @DisplayName("Executing the same plan twice should change nothing the second time")
        void executeIsResumable() {
            InMemoryPersonStore store = roster();
            DeduplicationCoordinator coordinator = coordinator(store);
            coordinator.dryRun();
            coordinator.executePlan(new CancellationToken());

            ExecutionResult again = coordinator.executePlan(new CancellationToken());

            assertEquals(0, again.executed());
            assertEquals(7, again.alreadyDone());
            assertEquals(5, store.countPersons());
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should require a store or a graph connection")
        void requiresStore() {
            assertThrows(IllegalStateException.class, () -> DeduplicationCoordinator.builder().build());
        }

        @Test
        @DisplayName("Should run the passes in order 0 to 6")
        void passOrder() {
            List<Integer> numbers = coordinator(roster()).passes().stream()
                    .map(p -> p.number())
                    .toList();

            assertEquals(List.of(0, 1, 2, 3, 4, 5, 6), numbers);
        }

        @Test
        @DisplayName("Should load the bundled variant tables when none are given")
        void bundledTables() {
            DeduplicationCoordinator coordinator = DeduplicationCoordinator.builder()
                    .store(new InMemoryPersonStore())
                    .protectedNames(ProtectedNames.empty())
                    .planStore(new JsonPlanStore(dir.resolve("plan.json")))
                    .build();

            DeduplicationReport report = coordinator.dryRun();

            assertEquals(0, report.totalChanges());
            assertEquals(0, report.plan().orElseThrow().getActions().size());
        }
    }
}
