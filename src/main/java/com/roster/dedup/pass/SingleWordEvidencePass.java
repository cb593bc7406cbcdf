package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.evidence.EvidenceScore;
import com.roster.dedup.evidence.EvidenceScorer;
import com.roster.dedup.evidence.EvidenceScorer.EvidenceDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pass 2: merges a single-word person into the multi-word person containing that word when
 * shared documents and connections point at exactly one of them, or one of them clearly wins.
 * Ambiguous cases are logged and left for pass 3.
 *
 * <p>Evidence is read once when the pass starts, including what earlier passes absorbed, so a
 * merge made by this pass never changes the scores of later single words.</p>
 */
public class SingleWordEvidencePass implements DeduplicationPass {
    private static final Logger log = LoggerFactory.getLogger(SingleWordEvidencePass.class);

    static final String REASON = "single-word evidence";
    static final int MIN_WORD_LENGTH = 3;

    private final EvidenceScorer scorer;

    public SingleWordEvidencePass() {
        this(new EvidenceScorer());
    }

    public SingleWordEvidencePass(EvidenceScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public int number() {
        return 2;
    }

    @Override
    public String name() {
        return "single-word evidence";
    }

    @Override
    public PassResult run(PassContext context) {
        List<Person> singles = new ArrayList<>();
        Map<String, List<Person>> wordIndex = new HashMap<>();
        Map<Long, String> singleWords = new HashMap<>();
        Map<Long, Set<Long>> documents = new HashMap<>();
        Map<Long, Set<Long>> connections = new HashMap<>();
        for (Person person : context.livePersons()) {
            List<String> parts = context.getNormalizer().meaningfulParts(person.getName());
            if (parts.isEmpty()) {
                continue;
            }
            if (parts.size() == 1) {
                singles.add(person);
                singleWords.put(person.getId(), parts.get(0));
            } else {
                for (String part : parts) {
                    wordIndex.computeIfAbsent(part, k -> new ArrayList<>()).add(person);
                }
            }
            documents.put(person.getId(), Set.copyOf(context.documentsOf(person.getId())));
            connections.put(person.getId(), Set.copyOf(context.connectionsOf(person.getId())));
        }

        int failuresBefore = context.getFailures();
        int merged = 0;
        int ambiguous = 0;
        for (Person single : singles) {
            String word = singleWords.get(single.getId());
            if (word.length() < MIN_WORD_LENGTH || context.isRetired(single.getId())) {
                continue;
            }
            if (context.isProtected(single)) {
                log.debug("pass2.protected name='{}'", single.getName());
                continue;
            }
            List<Person> candidates = wordIndex.getOrDefault(word, List.of()).stream()
                    .filter(c -> !context.isRetired(c.getId()))
                    .distinct()
                    .toList();
            if (candidates.isEmpty()) {
                continue;
            }

            Set<Long> singleDocs = documents.get(single.getId());
            Set<Long> singleConns = connections.get(single.getId());
            List<EvidenceScore> scores = new ArrayList<>();
            for (Person candidate : candidates) {
                scores.add(scorer.score(singleDocs, singleConns, candidate,
                        documents.get(candidate.getId()), connections.get(candidate.getId())));
            }

            EvidenceDecision decision = scorer.decide(scores);
            if (decision.isAmbiguous()) {
                EvidenceScore first = decision.ranked().get(0);
                EvidenceScore second = decision.ranked().get(1);
                log.info("pass2.ambiguous name='{}' top='{}' ({}) runnerUp='{}' ({})",
                        single.getName(), first.candidate().getName(), first.score(),
                        second.candidate().getName(), second.score());
                ambiguous++;
                continue;
            }
            if (decision.winner().isEmpty()) {
                continue;
            }

            EvidenceScore winner = decision.winner().get();
            if (context.merge(number(), REASON, winner.candidate(), List.of(single),
                    List.of(single.getName()), winner.describe())) {
                merged++;
                log.debug("pass2.merge name='{}' winner='{}' score={} kind={}",
                        single.getName(), winner.candidate().getName(), winner.score(),
                        decision.kind().orElse(null));
            }
        }
        log.info("pass2.completed merged={} ambiguous={}", merged, ambiguous);
        return new PassResult(number(), name(), merged, merged, ambiguous,
                context.getFailures() - failuresBefore, Duration.ZERO);
    }
}
