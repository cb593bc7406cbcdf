package com.roster.dedup.rules;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Pure predicate that flags strings misidentified as person names: titles, placeholders,
 * OCR artifacts, organizations and relational descriptions.
 *
 * <p>Rules are evaluated in declaration order and the first match wins. Order only affects
 * which rule name {@link #classify(String)} reports, never the boolean outcome of
 * {@link #isJunk(String)}.</p>
 */
public final class JunkNameClassifier {

    private static final int MIN_LENGTH = 2;
    private static final int MAX_LENGTH = 60;

    private static final Set<String> GENERIC_ROLES = Set.of(
            "assistant united states attorney",
            "special agent",
            "case agent name",
            "correctional officer",
            "attorney general",
            "unit manager",
            "senior inspector",
            "supervisory inspector",
            "fbi assistant director",
            "deputy united states attorney",
            "supervisory staff attorney clc",
            "unknown recipient",
            "unknown sender",
            "institution duty officer",
            "victim witness coordinator",
            "day watch shu officer in charge",
            "evening watch shu officer in charge",
            "u.s. attorney",
            "assistant u.s. attorney",
            "detective",
            "officer",
            "captain",
            "sergeant",
            "warden",
            "chief",
            "administrator",
            "attorney",
            "defendant",
            "lieutenant",
            "budget",
            "unknown"
    );

    private static final Set<String> GENERIC_NONPERSONS = Set.of(
            "bop employee",
            "the court",
            "union president",
            "flight engineer",
            "customs officer",
            "co-pilot",
            "fbi victim specialist",
            "legal assistant",
            "defense counsel",
            "corrections officer"
    );

    private static final Set<String> PRONOUN_FRAGMENTS = Set.of(
            "her", "his", "him", "she", "he", "des", "ands");

    private static final Pattern OFFICE_HEAD = Pattern.compile(
            "^(chief|director|head|commissioner|superintendent|warden|commander)\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD_OF = Pattern.compile("\\bof\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private static final List<JunkRule> RULES = List.of(
            new JunkRule("too-short", s -> s.length() <= MIN_LENGTH),
            new JunkRule("too-long", s -> s.length() > MAX_LENGTH),
            rule("special-characters", "[!;&$%^°•\\\\*<>=]"),
            new JunkRule("slash", s -> s.indexOf('/') >= 0),
            rule("consecutive-digits", "[0-9]{2,}"),
            rule("digit-letter-digit", "[0-9].*[a-zA-Z].*[0-9]"),
            rule("digit-inside-word", "^[A-Z][a-z]*[0-9][a-z]"),
            rule("bracketed", "^\\[.*\\]$"),
            rule("caps-abbreviation", "^[A-Z]{4,}$"),
            new JunkRule("generic-role", s -> GENERIC_ROLES.contains(lower(s))),
            ruleIgnoreCase("epstein-possessive", "^epstein's\\s"),
            new JunkRule("epstein-victim", s -> lower(s).equals("epstein victim")),
            ruleIgnoreCase("numbered-victim", "^(minor\\s+)?victim-\\d"),
            ruleIgnoreCase("unknown-prefix", "^unknown\\s"),
            ruleIgnoreCase("unnamed-prefix", "^unnamed\\s"),
            ruleIgnoreCase("title-redacted", "^(mr|mrs|ms|dr)\\.\\s*\\["),
            ruleIgnoreCase("title-only", "^(mr|mrs|ms|dr|lt|sgt|det|cap)\\.\\s*$"),
            new JunkRule("short-single-word", s -> !hasWhitespace(s) && s.length() <= 3),
            rule("caps-three-letter", "^[A-Z]{3}$"),
            new JunkRule("generic-nonperson", s -> GENERIC_NONPERSONS.contains(lower(s))),
            new JunkRule("pronoun-fragment", s -> PRONOUN_FRAGMENTS.contains(lower(s))),
            ruleIgnoreCase("organization-suffix", ",?\\s*(llc|inc|corp|lp|llp)\\.?\\s*$"),
            rule("possessive", "'s\\s"),
            ruleIgnoreCase("the-prefix", "^the\\s"),
            ruleIgnoreCase("former-prefix", "^former\\s"),
            new JunkRule("office-of-title", s ->
                    find(OFFICE_HEAD, s) && find(WORD_OF, s)),
            ruleIgnoreCase("deputy-title",
                    "^(deputy|assistant|associate|acting|interim)\\s+(assistant\\s+)?"
                            + "(attorney general|director|chief|commissioner|warden|prosecutor|counsel)"),
            rule("parenthetical-org-tag", "\\([A-Z]{2,5}\\)"),
            ruleIgnoreCase("ausa-prefix", "^ausa\\s"),
            ruleIgnoreCase("numbered-placeholder", "^(officer|inmate|co\\s+rookie)\\s+\\d"),
            ruleIgnoreCase("john-doe", "^(john|jane)\\s+doe"),
            ruleIgnoreCase("title-initial", "^(mr|mrs|ms|dr)\\.\\s+[A-Z]\\.?\\s*$"),
            ruleIgnoreCase("declarant", "^declarant"),
            rule("comma-digit", ",\\s*\\d"),
            ruleIgnoreCase("credential-only", "^(esq\\.?|psyd|ph\\.?d\\.?|m\\.?d\\.?|j\\.?d\\.?|ll\\.?m\\.?)$"),
            new JunkRule("escaped-quotes", s -> (s.indexOf('"') >= 0 || s.indexOf('\\') >= 0) && s.length() < 30),
            ruleIgnoreCase("relational-description",
                    "^(spouse|sister|brother|son|daughter|mother|father|wife|husband)\\s+of\\s"),
            ruleIgnoreCase("redacted-suffix", "\\(redacted\\)$"),
            ruleIgnoreCase("numbered-witness", "^(accuser|witness|doe)\\s*-?\\s*\\d")
    );

    /**
     * Returns true if the name should be removed outright.
     */
    public boolean isJunk(String name) {
        return classify(name).isPresent();
    }

    /**
     * Returns the name of the first matching rule, or empty for a plausible person name.
     * A null name is classified as {@code too-short}.
     */
    public Optional<String> classify(String name) {
        String trimmed = name != null ? name.strip() : "";
        for (JunkRule rule : RULES) {
            if (rule.test().test(trimmed)) {
                return Optional.of(rule.name());
            }
        }
        return Optional.empty();
    }

    private static JunkRule rule(String name, String regex) {
        Pattern pattern = Pattern.compile(regex);
        return new JunkRule(name, s -> pattern.matcher(s).find());
    }

    private static JunkRule ruleIgnoreCase(String name, String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return new JunkRule(name, s -> pattern.matcher(s).find());
    }

    private static boolean find(Pattern pattern, String s) {
        return pattern.matcher(s).find();
    }

    private static boolean hasWhitespace(String s) {
        return WHITESPACE.matcher(s).find();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private record JunkRule(String name, Predicate<String> test) {}
}
