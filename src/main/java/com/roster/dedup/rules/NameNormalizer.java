package com.roster.dedup.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw person names for equality grouping.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>lower-case</li>
 *   <li>"Last, First" (exactly one comma, non-empty tail) becomes "First Last"</li>
 *   <li>honorifics and generational suffixes ({@code dr mr mrs ms miss ii iii iv}) are removed as whole words</li>
 *   <li>periods removed, keeping the letters ("J." becomes "j")</li>
 *   <li>every character other than {@code a-z} and whitespace removed</li>
 *   <li>whitespace collapsed and trimmed</li>
 * </ol>
 *
 * <p>Stateless and thread-safe. Every pass and the canonical selector share the same instance
 * so grouping is byte-for-byte consistent across a run.</p>
 */
public final class NameNormalizer {

    /** Minimum length of a token that counts as a meaningful word part. */
    public static final int MIN_MEANINGFUL_LENGTH = 2;

    private static final Pattern TITLES = Pattern.compile("\\b(dr|mr|mrs|ms|miss|ii|iii|iv)\\b\\.?");
    private static final Pattern PERIODS = Pattern.compile("\\.");
    private static final Pattern NON_LETTERS = Pattern.compile("[^a-z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final NameNormalizer INSTANCE = new NameNormalizer();

    private NameNormalizer() {
    }

    public static NameNormalizer getInstance() {
        return INSTANCE;
    }

    /**
     * Normalizes a raw name. Returns an empty string for null or blank input.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String n = name.toLowerCase(Locale.ROOT);

        if (n.indexOf(',') >= 0) {
            String[] parts = n.split(",", -1);
            if (parts.length == 2) {
                String last = parts[0].trim();
                String first = parts[1].trim();
                if (!first.isEmpty()) {
                    n = first + " " + last;
                }
            }
        }

        n = TITLES.matcher(n).replaceAll("");
        n = PERIODS.matcher(n).replaceAll("");
        n = NON_LETTERS.matcher(n).replaceAll("");
        n = WHITESPACE.matcher(n).replaceAll(" ");
        return n.trim();
    }

    /**
     * Tokens of the normalized name with at least {@value #MIN_MEANINGFUL_LENGTH} characters.
     */
    public List<String> meaningfulParts(String name) {
        String normalized = normalize(name);
        List<String> parts = new ArrayList<>();
        if (normalized.isEmpty()) {
            return parts;
        }
        for (String token : normalized.split(" ")) {
            if (token.length() >= MIN_MEANINGFUL_LENGTH) {
                parts.add(token);
            }
        }
        return parts;
    }
}
