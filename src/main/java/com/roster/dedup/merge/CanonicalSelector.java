package com.roster.dedup.merge;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.rules.NameNormalizer;
import com.roster.dedup.rules.ProtectedNames;

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;

/**
 * Picks the surviving person of a candidate group.
 *
 * <p>Priority, first difference wins:</p>
 * <ol>
 *   <li>protected name</li>
 *   <li>no comma in the raw name</li>
 *   <li>not all upper-case</li>
 *   <li>more meaningful word parts</li>
 *   <li>longer raw name</li>
 *   <li>lower id</li>
 * </ol>
 * Ids are unique, so the order is total.
 */
public class CanonicalSelector {

    private final ProtectedNames protectedNames;
    private final NameNormalizer normalizer;
    private final Comparator<Person> order;

    public CanonicalSelector(ProtectedNames protectedNames) {
        this.protectedNames = protectedNames;
        this.normalizer = NameNormalizer.getInstance();
        this.order = Comparator
                .comparing((Person p) -> !this.protectedNames.isProtected(p.getName()))
                .thenComparing(p -> p.getName().contains(","))
                .thenComparing(p -> isAllCaps(p.getName()))
                .thenComparing(Comparator.comparingInt((Person p) -> normalizer.meaningfulParts(p.getName()).size())
                        .reversed())
                .thenComparing(Comparator.comparingInt((Person p) -> p.getName().length()).reversed())
                .thenComparingLong(Person::getId);
    }

    /**
     * Best candidate first.
     */
    public Comparator<Person> order() {
        return order;
    }

    /**
     * @throws IllegalArgumentException if the group is empty
     */
    public Person select(Collection<Person> group) {
        return group.stream()
                .min(order)
                .orElseThrow(() -> new IllegalArgumentException("Cannot select a canonical from an empty group"));
    }

    // A name without letters counts as all-caps, the same as comparing it to its upper-cased form.
    private static boolean isAllCaps(String name) {
        return name.equals(name.toUpperCase(Locale.ROOT));
    }
}
