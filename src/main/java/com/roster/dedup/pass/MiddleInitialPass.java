package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pass 5: merges a two-word name with the single three-or-more-word name sharing its first
 * and last word ("John Smith" and "John Q Smith"). The person with more document and
 * connection references survives; on a tie the lower id survives. A protected person is never
 * the one absorbed.
 */
public class MiddleInitialPass implements DeduplicationPass {
    private static final Logger log = LoggerFactory.getLogger(MiddleInitialPass.class);

    static final String REASON = "middle-initial variant";

    @Override
    public int number() {
        return 5;
    }

    @Override
    public String name() {
        return "middle-initial";
    }

    @Override
    public PassResult run(PassContext context) {
        List<Person> twoWord = new ArrayList<>();
        Map<Long, String> twoWordKeys = new HashMap<>();
        Map<String, List<Person>> longIndex = new HashMap<>();
        for (Person person : context.livePersons()) {
            List<String> parts = context.getNormalizer().meaningfulParts(person.getName());
            String key = parts.isEmpty() ? null : parts.get(0) + "|" + parts.get(parts.size() - 1);
            if (parts.size() == 2) {
                twoWord.add(person);
                twoWordKeys.put(person.getId(), key);
            } else if (parts.size() >= 3) {
                longIndex.computeIfAbsent(key, k -> new ArrayList<>()).add(person);
            }
        }

        int failuresBefore = context.getFailures();
        int merged = 0;
        int ambiguous = 0;
        for (Person shortForm : twoWord) {
            if (context.isRetired(shortForm.getId())) {
                continue;
            }
            List<Person> matches = longIndex.getOrDefault(twoWordKeys.get(shortForm.getId()), List.of()).stream()
                    .filter(p -> !context.isRetired(p.getId()))
                    .toList();
            if (matches.size() > 1) {
                log.info("pass5.ambiguous name='{}' matches={}", shortForm.getName(),
                        matches.stream().map(Person::getName).toList());
                ambiguous++;
                continue;
            }
            if (matches.isEmpty()) {
                continue;
            }

            Person longForm = matches.get(0);
            int shortTotal = context.referenceTotal(shortForm.getId());
            int longTotal = context.referenceTotal(longForm.getId());

            Person canonical;
            if (shortTotal == longTotal) {
                canonical = shortForm.getId() < longForm.getId() ? shortForm : longForm;
            } else {
                canonical = shortTotal > longTotal ? shortForm : longForm;
            }
            Person duplicate = canonical == shortForm ? longForm : shortForm;

            if (context.isProtected(duplicate)) {
                if (context.isProtected(canonical)) {
                    log.info("pass5.protected names='{}','{}'", shortForm.getName(), longForm.getName());
                    continue;
                }
                Person swap = canonical;
                canonical = duplicate;
                duplicate = swap;
            }

            String evidence = "2-word data: " + shortTotal + ", 3+-word data: " + longTotal;
            if (context.merge(number(), REASON, canonical, List.of(duplicate), List.of(duplicate.getName()), evidence)) {
                merged++;
                log.debug("pass5.merge duplicate='{}' canonical='{}' {}",
                        duplicate.getName(), canonical.getName(), evidence);
            }
        }
        log.info("pass5.completed merged={} ambiguous={}", merged, ambiguous);
        return new PassResult(number(), name(), merged, merged, ambiguous,
                context.getFailures() - failuresBefore, Duration.ZERO);
    }
}
