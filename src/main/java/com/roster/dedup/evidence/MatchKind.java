package com.roster.dedup.evidence;

/**
 * Why a single-word person was accepted as belonging to a multi-word candidate.
 */
public enum MatchKind {
    /** Exactly one candidate shares any evidence. */
    ONLY_MATCH,
    /** The top candidate scores at least the clear-winner ratio times the runner-up. */
    CLEAR_WINNER
}
