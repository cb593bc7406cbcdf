package com.roster.dedup.plan;

import com.roster.dedup.core.model.PersonRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlanSummary")
class PlanSummaryTest {

    @Test
    @DisplayName("Counts should be grouped per pass in pass order with fixed labels")
    void groupsByPass() {
        PersonRef a = new PersonRef(1, "Glenn Dubin");
        PersonRef b = new PersonRef(2, "Glen Dubin");
        List<DeduplicationAction> actions = List.of(
                DeduplicationAction.merge(1, 4, "key figure variant", a, List.of(b), null),
                DeduplicationAction.delete(2, 0, "junk name", List.of(new PersonRef(3, "Unknown"))),
                DeduplicationAction.delete(3, 0, "junk name", List.of(new PersonRef(4, "AUSA"))),
                DeduplicationAction.delete(4, 4, "junk variant of Glenn Dubin", List.of(new PersonRef(5, "Glenn Dubn"))));

        PlanSummary summary = PlanSummary.of(actions);

        assertEquals(4, summary.totalActions());
        assertEquals(List.of("0", "4"), List.copyOf(summary.byPass().keySet()));
        assertEquals(new PassSummary(2, "delete", "junk removal"), summary.byPass().get("0"));
        assertEquals(new PassSummary(2, "mixed", "key figure variants"), summary.byPass().get("4"));
    }

    @Test
    @DisplayName("An empty plan should have an empty summary")
    void emptyPlan() {
        PlanSummary summary = PlanSummary.of(List.of());

        assertEquals(0, summary.totalActions());
        assertTrue(summary.byPass().isEmpty());
    }

    @Test
    @DisplayName("Unknown pass numbers should be rejected")
    void unknownPass() {
        assertThrows(IllegalArgumentException.class, () -> PassLabel.forPass(7));
    }
}
