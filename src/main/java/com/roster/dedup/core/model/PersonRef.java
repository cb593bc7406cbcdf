package com.roster.dedup.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Lightweight (id, name) pair recorded in plan actions.
 * The name is kept for the audit trail; only the id is authoritative.
 */
public record PersonRef(long id, String name) {

    @JsonCreator
    public PersonRef(@JsonProperty("id") long id, @JsonProperty("name") String name) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name is required");
    }
}
