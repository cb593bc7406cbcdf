package com.roster.dedup.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    private final NameNormalizer normalizer = NameNormalizer.getInstance();

    @Test
    @DisplayName("Should return empty string for null and blank inputs")
    void testNullAndBlank() {
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize("   "));
    }

    @ParameterizedTest
    @DisplayName("Should normalize raw names")
    @CsvSource(delimiter = '|', value = {
            "Ghislaine Maxwell|ghislaine maxwell",
            "GHISLAINE MAXWELL|ghislaine maxwell",
            "Maxwell, Ghislaine|ghislaine maxwell",
            "MAXWELL,GHISLAINE|ghislaine maxwell",
            "Dr. John Smith|john smith",
            "Mr.Smith|smith",
            "Miss Jane Roe|jane roe",
            "John Smith III|john smith",
            "John Q. Smith|john q smith",
            "Jean-Luc Brunel|jeanluc brunel",
            "O'Brien Patrick|obrien patrick",
            "  Mary    Ann  Jones |mary ann jones",
            "Ivan Drago|ivan drago"
    })
    void testNormalize(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @Test
    @DisplayName("Should only swap 'Last, First' when there is exactly one comma and a non-empty tail")
    void testCommaHandling() {
        assertEquals("smith", normalizer.normalize("Smith,"));
        assertEquals("smith john jr", normalizer.normalize("Smith, John, Jr"));
    }

    @Test
    @DisplayName("Should drop single-letter tokens from meaningful parts")
    void testMeaningfulParts() {
        assertEquals(List.of("john", "smith"), normalizer.meaningfulParts("John Q. Smith"));
        assertEquals(List.of("smith"), normalizer.meaningfulParts("J. Smith"));
        assertEquals(List.of(), normalizer.meaningfulParts("Dr."));
        assertEquals(List.of(), normalizer.meaningfulParts(null));
    }

    @Test
    @DisplayName("Formatting variants should normalize to the same key")
    void testFormattingVariants() {
        assertEquals(normalizer.normalize("GHISLAINE MAXWELL"), normalizer.normalize("Maxwell, Ghislaine"));
        assertEquals("jane roe", normalizer.normalize("Dr. Jane Roe"));
        assertNotEquals(normalizer.normalize("Jane Roe"), normalizer.normalize("Jane Q. Roe"));
    }

    @Test
    @DisplayName("Normalization should be idempotent")
    void testIdempotent() {
        for (String raw : List.of("Maxwell, Ghislaine", "Dr. John Q. Smith III", "Jean-Luc Brunel")) {
            String once = normalizer.normalize(raw);
            assertEquals(once, normalizer.normalize(once));
        }
    }
}
