package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.rules.JunkNameClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pass 0: deletes every non-protected person whose name is junk.
 */
public class JunkRemovalPass implements DeduplicationPass {
    private static final Logger log = LoggerFactory.getLogger(JunkRemovalPass.class);

    static final String REASON = "junk name";

    @Override
    public int number() {
        return 0;
    }

    @Override
    public String name() {
        return "junk removal";
    }

    @Override
    public PassResult run(PassContext context) {
        JunkNameClassifier classifier = context.getJunkClassifier();
        List<Person> junk = new ArrayList<>();
        for (Person person : context.livePersons()) {
            Optional<String> rule = classifier.classify(person.getName());
            if (rule.isEmpty()) {
                continue;
            }
            if (context.isProtected(person)) {
                log.info("pass0.protected name='{}' rule={}", person.getName(), rule.get());
                continue;
            }
            log.debug("pass0.junk id={} name='{}' rule={}", person.getId(), person.getName(), rule.get());
            junk.add(person);
        }

        int failuresBefore = context.getFailures();
        int removed = context.delete(number(), REASON, junk);
        log.info("pass0.completed {}={}", context.isDryRun() ? "found" : "removed", removed);
        return new PassResult(number(), name(), removed, removed, 0,
                context.getFailures() - failuresBefore, Duration.ZERO);
    }
}
