package com.roster.dedup.rules;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Curated roster of trusted names that must never be deleted or absorbed as an alias.
 * Membership is tested on the normalized form, so "MAXWELL, GHISLAINE" is protected
 * when "Ghislaine Maxwell" is on the roster.
 */
public final class ProtectedNames {

    private static final ProtectedNames EMPTY = new ProtectedNames(Set.of());

    private final Set<String> normalizedNames;

    private ProtectedNames(Set<String> normalizedNames) {
        this.normalizedNames = Set.copyOf(normalizedNames);
    }

    public static ProtectedNames empty() {
        return EMPTY;
    }

    /**
     * Builds a roster from raw names, normalizing each one.
     */
    public static ProtectedNames of(Collection<String> rawNames) {
        NameNormalizer normalizer = NameNormalizer.getInstance();
        Set<String> normalized = new HashSet<>();
        for (String raw : rawNames) {
            String n = normalizer.normalize(raw);
            if (!n.isEmpty()) {
                normalized.add(n);
            }
        }
        return new ProtectedNames(normalized);
    }

    public boolean isProtected(String rawName) {
        return normalizedNames.contains(NameNormalizer.getInstance().normalize(rawName));
    }

    public int size() {
        return normalizedNames.size();
    }
}
