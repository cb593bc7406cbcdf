package com.roster.dedup.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Guards string values that are written into Cypher statements.
 */
public final class InputSanitizer {

    /** Maximum allowed length for a string bound into a Cypher statement. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a string value for safe use in Cypher statements.
     *
     * @throws IllegalArgumentException if the value is too long or contains control characters
     */
    public static String sanitizeForCypher(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
        if (containsControlCharacters(value)) {
            throw new IllegalArgumentException("Value must not contain control characters");
        }
        return value;
    }

    /**
     * Sanitizes every alias of a list, returning a new list.
     */
    public static List<String> sanitizeAll(List<String> values) {
        List<String> sanitized = new ArrayList<>(values.size());
        for (String value : values) {
            sanitized.add(sanitizeForCypher(value));
        }
        return sanitized;
    }

    /**
     * ASCII control characters (0x00-0x1F, 0x7F) other than tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
