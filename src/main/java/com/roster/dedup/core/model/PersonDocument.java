package com.roster.dedup.core.model;

/**
 * Mention link between a person and a document.
 * After any merge there is at most one row per (personId, documentId) pair.
 *
 * @param id         row id; the lowest id wins when duplicate rows are collapsed
 * @param personId   mentioned person
 * @param documentId document containing the mention
 * @param context    optional excerpt around the mention
 */
public record PersonDocument(long id, long personId, long documentId, String context) {

    public PersonDocument withPersonId(long newPersonId) {
        return new PersonDocument(id, newPersonId, documentId, context);
    }
}
