package com.roster.dedup.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A person record as extracted by upstream ingestion.
 * Core domain object for deduplication. The normalized form of the name is never
 * stored; it is always recomputed by {@link com.roster.dedup.rules.NameNormalizer}.
 *
 * <p>{@code documentCount} and {@code connectionCount} are derived values that can be
 * recomputed from the link tables at any time and are not authoritative.</p>
 */
public final class Person {
    private final long id;
    private final String name;
    private final List<String> aliases;
    private final String category;
    private final String role;
    private final String description;
    private final PersonStatus status;
    private final int documentCount;
    private final int connectionCount;

    private Person(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.aliases = builder.aliases != null ? List.copyOf(builder.aliases) : List.of();
        this.category = builder.category;
        this.role = builder.role;
        this.description = builder.description;
        this.status = builder.status != null ? builder.status : PersonStatus.NAMED;
        this.documentCount = builder.documentCount;
        this.connectionCount = builder.connectionCount;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getCategory() {
        return category;
    }

    public String getRole() {
        return role;
    }

    public String getDescription() {
        return description;
    }

    public PersonStatus getStatus() {
        return status;
    }

    public int getDocumentCount() {
        return documentCount;
    }

    public int getConnectionCount() {
        return connectionCount;
    }

    public PersonRef toRef() {
        return new PersonRef(id, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Person person = (Person) o;
        return id == person.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Person{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", aliases=" + aliases +
                ", status=" + status +
                ", documentCount=" + documentCount +
                ", connectionCount=" + connectionCount +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Person person) {
        return new Builder()
                .id(person.id)
                .name(person.name)
                .aliases(person.aliases)
                .category(person.category)
                .role(person.role)
                .description(person.description)
                .status(person.status)
                .documentCount(person.documentCount)
                .connectionCount(person.connectionCount);
    }

    public static class Builder {
        private Long idValue;
        private long id;
        private String name;
        private List<String> aliases;
        private String category;
        private String role;
        private String description;
        private PersonStatus status;
        private int documentCount;
        private int connectionCount;

        public Builder id(long id) {
            this.id = id;
            this.idValue = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = aliases != null ? new ArrayList<>(aliases) : null;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(PersonStatus status) {
            this.status = status;
            return this;
        }

        public Builder documentCount(int documentCount) {
            this.documentCount = documentCount;
            return this;
        }

        public Builder connectionCount(int connectionCount) {
            this.connectionCount = connectionCount;
            return this;
        }

        public Person build() {
            Objects.requireNonNull(idValue, "id is required");
            Objects.requireNonNull(name, "name is required");
            return new Person(this);
        }
    }
}
