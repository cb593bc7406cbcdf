package com.roster.dedup.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JunkNameClassifier Tests")
class JunkNameClassifierTest {

    private final JunkNameClassifier classifier = new JunkNameClassifier();

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Should report the first matching rule")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "Al|too-short",
            "John!|special-characters",
            "John/Jane Smith|slash",
            "Inmate 12345|consecutive-digits",
            "Room 1 B 2|digit-letter-digit",
            "Jo3n Smith|digit-inside-word",
            "[REDACTED]|bracketed",
            "NYPD|caps-abbreviation",
            "AUSA|caps-abbreviation",
            "Special Agent|generic-role",
            "ASSISTANT UNITED STATES ATTORNEY|generic-role",
            "Epstein's pilot|epstein-possessive",
            "Epstein Victim|epstein-victim",
            "Victim-3|numbered-victim",
            "Unknown Male|unknown-prefix",
            "Unnamed Pilot|unnamed-prefix",
            "Mr. [Redacted]|title-redacted",
            "Dr.|title-only",
            "Bob|short-single-word",
            "FBI|short-single-word",
            "BOP Employee|generic-nonperson",
            "ands|pronoun-fragment",
            "Acme Holdings LLC|organization-suffix",
            "LLC Holdings, Inc.|organization-suffix",
            "Jeffrey's friend|possessive",
            "The Defendant|the-prefix",
            "The Ambassador|the-prefix",
            "Former President|former-prefix",
            "Director of Communications|office-of-title",
            "Deputy Director Smith|deputy-title",
            "John Smith (FBI)|parenthetical-org-tag",
            "AUSA Jones|ausa-prefix",
            "Officer 5|numbered-placeholder",
            "Jane Doe|john-doe",
            "Mr. J.|title-initial",
            "Mr. M|title-initial",
            "Declarant Smith|declarant",
            "Smith, 2|comma-digit",
            "Esq.|credential-only",
            "Wife of John Smith|relational-description",
            "John Smith (Redacted)|redacted-suffix",
            "Witness 4|numbered-witness"
    })
    void testJunkRules(String name, String expectedRule) {
        assertEquals(Optional.of(expectedRule), classifier.classify(name));
        assertTrue(classifier.isJunk(name));
    }

    @ParameterizedTest
    @DisplayName("Should accept plausible person names")
    @ValueSource(strings = {
            "Jeffrey Epstein",
            "Ghislaine Maxwell",
            "Maxwell, Ghislaine",
            "Jean-Luc Brunel",
            "John Q. Smith",
            "Sarah Kellen",
            "Glenn Dubin",
            "Nadia Marcinkova",
            "Alan M. Dershowitz"
    })
    void testPlausibleNames(String name) {
        assertEquals(Optional.empty(), classifier.classify(name));
        assertFalse(classifier.isJunk(name));
    }

    @Test
    @DisplayName("Should flag overlong strings")
    void testTooLong() {
        assertEquals(Optional.of("too-long"), classifier.classify("A".repeat(61)));
        assertTrue(classifier.classify("Abcdefghij Klmnopqrst").isEmpty());
    }

    @Test
    @DisplayName("Should flag short strings carrying escaped quotes")
    void testEscapedQuotes() {
        assertEquals(Optional.of("escaped-quotes"), classifier.classify("\"Bubba\" Jones"));
        assertTrue(classifier.classify("\"Bubba\" Jones of the very long name here").isEmpty());
    }

    @Test
    @DisplayName("Should classify null as too short and trim surrounding whitespace")
    void testNullAndWhitespace() {
        assertEquals(Optional.of("too-short"), classifier.classify(null));
        assertEquals(Optional.of("too-short"), classifier.classify("  Al  "));
        assertFalse(classifier.isJunk("  Sarah Kellen  "));
    }
}
