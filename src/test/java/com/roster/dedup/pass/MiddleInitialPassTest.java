package com.roster.dedup.pass;

import com.roster.dedup.core.model.PersonRef;
import com.roster.dedup.plan.DeduplicationAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pass 5 - middle-initial variants")
class MiddleInitialPassTest {

    private final MiddleInitialPass pass = new MiddleInitialPass();

    @Test
    @DisplayName("The side with more references should survive")
    void moreReferencesSurvive() {
        PassContext context = new PassFixtures()
                .person(1, "John Smith")
                .person(2, "John Quincy Smith")
                .documents(1, 100)
                .documents(2, 100, 101)
                .dryRun();

        PassResult result = pass.run(context);

        assertEquals(1, result.changes());
        DeduplicationAction action = context.getActions().get(0);
        assertEquals(new PersonRef(2, "John Quincy Smith"), action.getCanonical());
        assertEquals(List.of(new PersonRef(1, "John Smith")), action.getDuplicates());
        assertEquals("2-word data: 1, 3+-word data: 2", action.getEvidence());
    }

    @Test
    @DisplayName("On equal references the lower id should survive")
    void tieKeepsLowerId() {
        PassFixtures fixtures = new PassFixtures()
                .person(7, "John Quincy Smith")
                .person(9, "John Smith");

        pass.run(fixtures.apply());

        assertEquals(List.of(7L), fixtures.personIds());
        assertEquals(List.of("John Smith"), fixtures.store().findPersonById(7).orElseThrow().getAliases());
    }

    @Test
    @DisplayName("Several long forms for one short form should be ambiguous")
    void multipleMatchesAmbiguous() {
        PassContext context = new PassFixtures()
                .person(1, "John Smith")
                .person(2, "John Quincy Smith")
                .person(3, "John Adams Smith")
                .dryRun();

        PassResult result = pass.run(context);

        assertEquals(0, result.changes());
        assertEquals(1, result.ambiguous());
    }

    @Test
    @DisplayName("A protected person should be kept as the canonical even with fewer references")
    void protectedIsNeverAbsorbed() {
        PassContext context = new PassFixtures()
                .person(1, "John Smith")
                .person(2, "John Quincy Smith")
                .documents(2, 100, 101)
                .protect("John Smith")
                .dryRun();

        pass.run(context);

        assertEquals(1L, context.getActions().get(0).getCanonical().id());
    }

    @Test
    @DisplayName("Both sides protected should be left alone")
    void bothProtectedSkipped() {
        PassContext context = new PassFixtures()
                .person(1, "John Smith")
                .person(2, "John Quincy Smith")
                .protect("John Smith", "John Quincy Smith")
                .dryRun();

        assertEquals(0, pass.run(context).changes());
    }

    @Test
    @DisplayName("Different first or last words should not match")
    void differentEndsDoNotMatch() {
        PassContext context = new PassFixtures()
                .person(1, "John Smith")
                .person(2, "Jane Quincy Smith")
                .person(3, "John Quincy Smyth")
                .dryRun();

        assertEquals(0, pass.run(context).changes());
    }
}
