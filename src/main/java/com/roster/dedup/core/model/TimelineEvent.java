package com.roster.dedup.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A dated event that references the persons involved.
 * {@code personIds} never contains an id twice.
 */
public record TimelineEvent(long id, String date, String title, List<Long> personIds) {

    public TimelineEvent {
        personIds = personIds != null ? List.copyOf(new LinkedHashSet<>(personIds)) : List.of();
    }

    public boolean references(long personId) {
        return personIds.contains(personId);
    }

    /**
     * Replaces {@code from} with {@code to} and collapses the resulting duplicates,
     * keeping the first occurrence.
     */
    public TimelineEvent replacePerson(long from, long to) {
        List<Long> replaced = new ArrayList<>(personIds.size());
        for (Long personId : personIds) {
            replaced.add(personId == from ? to : personId);
        }
        return new TimelineEvent(id, date, title, replaced);
    }

    public TimelineEvent withoutPersons(Set<Long> removed) {
        List<Long> kept = new ArrayList<>(personIds);
        kept.removeAll(removed);
        return new TimelineEvent(id, date, title, kept);
    }
}
