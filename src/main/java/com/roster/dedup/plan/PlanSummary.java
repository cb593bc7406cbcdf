package com.roster.dedup.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Action counts of a plan, in total and per pass. Passes without actions are absent.
 */
public record PlanSummary(int totalActions, Map<String, PassSummary> byPass) {

    public PlanSummary {
        byPass = byPass != null ? Collections.unmodifiableMap(new LinkedHashMap<>(byPass)) : Map.of();
    }

    public static PlanSummary of(List<DeduplicationAction> actions) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (DeduplicationAction action : actions) {
            counts.merge(action.getPass(), 1, Integer::sum);
        }
        Map<String, PassSummary> byPass = new LinkedHashMap<>();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            PassLabel label = PassLabel.forPass(entry.getKey());
            byPass.put(String.valueOf(entry.getKey()),
                    new PassSummary(entry.getValue(), label.type(), label.label()));
        }
        return new PlanSummary(actions.size(), byPass);
    }
}
