package com.roster.dedup.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSanitizer validation utility.
 */
class InputSanitizerTest {

    @Test
    void sanitizeForCypher_passesNull() {
        assertNull(InputSanitizer.sanitizeForCypher(null));
    }

    @Test
    void sanitizeForCypher_rejectsOverMaxLength() {
        String longValue = "A".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH + 1);
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.sanitizeForCypher(longValue));
    }

    @Test
    void sanitizeForCypher_acceptsMaxLength() {
        String maxValue = "A".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH);
        assertEquals(maxValue, InputSanitizer.sanitizeForCypher(maxValue));
    }

    @Test
    void sanitizeForCypher_rejectsControlCharacters() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.sanitizeForCypher("Glen\u0000Dubin"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.sanitizeForCypher("Glen\u007FDubin"));
    }

    @Test
    void sanitizeForCypher_acceptsWhitespaceAndAccents() {
        assertDoesNotThrow(() -> InputSanitizer.sanitizeForCypher("Nadia\tMarcinková\n"));
    }

    @Test
    void sanitizeAll_returnsNewList() {
        List<String> aliases = List.of("Glen Dubin", "GLENN DUBIN");
        assertEquals(aliases, InputSanitizer.sanitizeAll(aliases));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.sanitizeAll(List.of("ok", "bad\u0001")));
    }
}
