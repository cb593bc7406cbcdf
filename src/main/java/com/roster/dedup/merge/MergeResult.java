package com.roster.dedup.merge;

import java.util.List;

/**
 * Result of one merge of a duplicate group into its canonical person.
 *
 * @param applied         false when the merge was a no-op
 * @param canonicalId     the surviving person
 * @param mergedIds       duplicates that were absorbed
 * @param aliasesAdded    names newly added to the canonical's aliases
 * @param documentCount   recomputed document link count of the canonical
 * @param connectionCount recomputed connection count of the canonical
 * @param reason          why nothing happened, for a no-op
 */
public record MergeResult(
        boolean applied,
        long canonicalId,
        List<Long> mergedIds,
        List<String> aliasesAdded,
        int documentCount,
        int connectionCount,
        String reason
) {
    public MergeResult {
        mergedIds = mergedIds != null ? List.copyOf(mergedIds) : List.of();
        aliasesAdded = aliasesAdded != null ? List.copyOf(aliasesAdded) : List.of();
    }

    public static MergeResult applied(long canonicalId, List<Long> mergedIds, List<String> aliasesAdded,
                                      int documentCount, int connectionCount) {
        return new MergeResult(true, canonicalId, mergedIds, aliasesAdded, documentCount, connectionCount, null);
    }

    public static MergeResult noOp(long canonicalId, String reason) {
        return new MergeResult(false, canonicalId, List.of(), List.of(), 0, 0, reason);
    }
}
