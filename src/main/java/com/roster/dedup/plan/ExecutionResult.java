package com.roster.dedup.plan;

/**
 * Outcome of one execute-plan run.
 *
 * @param executed         actions applied in this run
 * @param skipped          actions whose targets were already gone
 * @param failed           actions that raised an error; they are marked skipped
 * @param remaining        pending actions not attempted because the run was cancelled
 * @param alreadyDone      actions already executed or skipped before this run
 * @param cancelled        true if cancellation stopped the run early
 * @param personCountAfter person count once the run finished
 */
public record ExecutionResult(
        int executed,
        int skipped,
        int failed,
        int remaining,
        int alreadyDone,
        boolean cancelled,
        long personCountAfter
) {
    /**
     * Result for a plan with nothing left to do.
     */
    public static ExecutionResult nothingPending(int alreadyDone, long personCount) {
        return new ExecutionResult(0, 0, 0, 0, alreadyDone, false, personCount);
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "executed=" + executed +
                ", skipped=" + skipped +
                ", failed=" + failed +
                ", remaining=" + remaining +
                ", alreadyDone=" + alreadyDone +
                ", cancelled=" + cancelled +
                ", personCountAfter=" + personCountAfter +
                '}';
    }
}
