package com.roster.dedup.pass;

import java.time.Duration;

/**
 * Counts reported by one pass.
 *
 * @param pass      pass number
 * @param name      pass name
 * @param changes   deletes or merges applied, or proposed in a dry-run
 * @param persons   persons removed or absorbed, or that would be
 * @param ambiguous groups skipped for insufficient evidence
 * @param failures  groups that failed and were skipped
 * @param duration  wall time of the pass
 */
public record PassResult(int pass, String name, int changes, int persons, int ambiguous, int failures,
                         Duration duration) {

    public PassResult withDuration(Duration elapsed) {
        return new PassResult(pass, name, changes, persons, ambiguous, failures, elapsed);
    }
}
