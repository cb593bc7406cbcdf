package com.roster.dedup.evidence;

import com.roster.dedup.core.model.Person;

/**
 * Shared evidence between a single-word person and one multi-word candidate.
 *
 * @param candidate         the multi-word candidate
 * @param sharedDocuments   documents linked to both persons
 * @param sharedConnections persons connected to both
 * @param score             weighted total
 */
public record EvidenceScore(Person candidate, int sharedDocuments, int sharedConnections, int score) {

    public boolean hasEvidence() {
        return score > 0;
    }

    /**
     * Human-readable evidence string recorded on plan actions.
     */
    public String describe() {
        return "score " + score + " (" + sharedDocuments + " shared docs, "
                + sharedConnections + " shared conns)";
    }
}
