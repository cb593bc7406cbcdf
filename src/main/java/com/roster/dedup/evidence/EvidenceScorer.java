package com.roster.dedup.evidence;

import com.roster.dedup.core.model.Person;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scores multi-word candidates for a single-word person and decides whether one of them
 * wins clearly enough to merge.
 */
public class EvidenceScorer {

    public static final int DEFAULT_DOCUMENT_WEIGHT = 2;
    public static final int DEFAULT_CONNECTION_WEIGHT = 1;
    public static final double DEFAULT_CLEAR_WINNER_RATIO = 2.0;

    private final int documentWeight;
    private final int connectionWeight;
    private final double clearWinnerRatio;

    public EvidenceScorer() {
        this(DEFAULT_DOCUMENT_WEIGHT, DEFAULT_CONNECTION_WEIGHT, DEFAULT_CLEAR_WINNER_RATIO);
    }

    public EvidenceScorer(int documentWeight, int connectionWeight, double clearWinnerRatio) {
        this.documentWeight = documentWeight;
        this.connectionWeight = connectionWeight;
        this.clearWinnerRatio = clearWinnerRatio;
    }

    public EvidenceScore score(Set<Long> singleDocs, Set<Long> singleConns,
                               Person candidate, Set<Long> candidateDocs, Set<Long> candidateConns) {
        int sharedDocs = 0;
        for (Long d : singleDocs) {
            if (candidateDocs.contains(d)) {
                sharedDocs++;
            }
        }
        int sharedConns = 0;
        for (Long c : singleConns) {
            if (candidateConns.contains(c)) {
                sharedConns++;
            }
        }
        return new EvidenceScore(candidate, sharedDocs, sharedConns,
                sharedDocs * documentWeight + sharedConns * connectionWeight);
    }

    /**
     * Picks the winning candidate among scored ones, or returns a decision with no winner.
     * Candidates without evidence are ignored. Equal scores keep the input order.
     */
    public EvidenceDecision decide(List<EvidenceScore> scores) {
        List<EvidenceScore> ranked = new ArrayList<>();
        for (EvidenceScore s : scores) {
            if (s.hasEvidence()) {
                ranked.add(s);
            }
        }
        ranked.sort(Comparator.comparingInt(EvidenceScore::score).reversed());

        if (ranked.isEmpty()) {
            return new EvidenceDecision(Optional.empty(), Optional.empty(), ranked);
        }
        if (ranked.size() == 1) {
            return new EvidenceDecision(Optional.of(ranked.get(0)), Optional.of(MatchKind.ONLY_MATCH), ranked);
        }
        if (ranked.get(0).score() >= clearWinnerRatio * ranked.get(1).score()) {
            return new EvidenceDecision(Optional.of(ranked.get(0)), Optional.of(MatchKind.CLEAR_WINNER), ranked);
        }
        return new EvidenceDecision(Optional.empty(), Optional.empty(), ranked);
    }

    /**
     * @param winner the accepted candidate, empty when there is no evidence or it is ambiguous
     * @param kind   how the winner was accepted
     * @param ranked candidates with evidence, best first
     */
    public record EvidenceDecision(Optional<EvidenceScore> winner, Optional<MatchKind> kind,
                                   List<EvidenceScore> ranked) {

        public EvidenceDecision {
            ranked = List.copyOf(ranked);
        }

        /**
         * True when two or more candidates had evidence but none won clearly.
         */
        public boolean isAmbiguous() {
            return winner.isEmpty() && ranked.size() > 1;
        }
    }
}
