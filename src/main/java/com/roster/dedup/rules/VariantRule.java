package com.roster.dedup.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a curated variant table: the canonical spelling of an individual,
 * spellings that should be merged into it, and spellings that should be deleted outright.
 */
public record VariantRule(String canonical, List<String> variants, List<String> deleteNames) {

    @JsonCreator
    public VariantRule(@JsonProperty("canonical") String canonical,
                       @JsonProperty("variants") List<String> variants,
                       @JsonProperty("deleteNames") List<String> deleteNames) {
        this.canonical = Objects.requireNonNull(canonical, "canonical is required");
        this.variants = variants != null ? List.copyOf(variants) : List.of();
        this.deleteNames = deleteNames != null ? List.copyOf(deleteNames) : List.of();
    }

    public VariantRule(String canonical, List<String> variants) {
        this(canonical, variants, null);
    }
}
