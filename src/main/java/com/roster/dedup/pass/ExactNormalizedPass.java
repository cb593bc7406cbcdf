package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pass 1: groups persons by normalized name and merges every group of two or more into
 * its canonical member.
 */
public class ExactNormalizedPass implements DeduplicationPass {
    private static final Logger log = LoggerFactory.getLogger(ExactNormalizedPass.class);

    static final String REASON = "exact normalized match";

    @Override
    public int number() {
        return 1;
    }

    @Override
    public String name() {
        return "exact normalized";
    }

    @Override
    public PassResult run(PassContext context) {
        Map<String, List<Person>> groups = new LinkedHashMap<>();
        for (Person person : context.livePersons()) {
            String normalized = context.getNormalizer().normalize(person.getName());
            if (normalized.isEmpty()) {
                continue;
            }
            groups.computeIfAbsent(normalized, k -> new ArrayList<>()).add(person);
        }

        int failuresBefore = context.getFailures();
        int merges = 0;
        int absorbed = 0;
        for (List<Person> group : groups.values()) {
            if (group.size() <= 1) {
                continue;
            }
            Person canonical = context.getCanonicalSelector().select(group);
            List<Person> duplicates = group.stream().filter(p -> p.getId() != canonical.getId()).toList();
            List<String> names = group.stream().map(Person::getName).toList();
            if (context.merge(number(), REASON, canonical, duplicates, names, null)) {
                merges++;
                absorbed += duplicates.size();
                log.debug("pass1.merge names={} canonical='{}'", names, canonical.getName());
            }
        }
        log.info("pass1.completed groups={} persons={}", merges, absorbed);
        return new PassResult(number(), name(), merges, absorbed, 0,
                context.getFailures() - failuresBefore, Duration.ZERO);
    }
}
