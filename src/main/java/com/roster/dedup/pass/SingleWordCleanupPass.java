package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pass 3: deletes every non-protected person still left with at most one meaningful word.
 */
public class SingleWordCleanupPass implements DeduplicationPass {
    private static final Logger log = LoggerFactory.getLogger(SingleWordCleanupPass.class);

    static final String REASON = "single-word name";

    @Override
    public int number() {
        return 3;
    }

    @Override
    public String name() {
        return "single-word cleanup";
    }

    @Override
    public PassResult run(PassContext context) {
        List<Person> targets = new ArrayList<>();
        for (Person person : context.livePersons()) {
            if (context.isProtected(person)) {
                continue;
            }
            String normalized = context.getNormalizer().normalize(person.getName());
            if (!normalized.isEmpty() && context.getNormalizer().meaningfulParts(person.getName()).size() <= 1) {
                targets.add(person);
            }
        }

        int failuresBefore = context.getFailures();
        int removed = context.delete(number(), REASON, targets);
        log.info("pass3.completed {}={}", context.isDryRun() ? "found" : "deleted", removed);
        return new PassResult(number(), name(), removed, removed, 0,
                context.getFailures() - failuresBefore, Duration.ZERO);
    }
}
