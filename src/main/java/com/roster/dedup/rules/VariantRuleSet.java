package com.roster.dedup.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Versioned table of {@link VariantRule}s, loaded from configuration so the ruleset can
 * evolve without rebuilding the engine.
 */
public record VariantRuleSet(String version, List<VariantRule> rules) {

    @JsonCreator
    public VariantRuleSet(@JsonProperty("version") String version,
                          @JsonProperty("rules") List<VariantRule> rules) {
        this.version = version != null ? version : "unversioned";
        this.rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public static VariantRuleSet empty() {
        return new VariantRuleSet("empty", List.of());
    }

    public int size() {
        return rules.size();
    }
}
