package com.roster.dedup.plan;

import java.util.Arrays;

/**
 * Fixed description of each pass as reported in a plan summary.
 */
public enum PassLabel {
    JUNK_REMOVAL(0, "delete", "junk removal"),
    EXACT_NORMALIZED(1, "merge", "exact normalized"),
    SINGLE_WORD_EVIDENCE(2, "merge", "single-word evidence"),
    SINGLE_WORD_CLEANUP(3, "delete", "single-word cleanup"),
    KEY_FIGURE_VARIANTS(4, "mixed", "key figure variants"),
    MIDDLE_INITIAL(5, "merge", "middle-initial"),
    OCR_NICKNAME(6, "merge", "OCR/nickname");

    private final int pass;
    private final String type;
    private final String label;

    PassLabel(int pass, String type, String label) {
        this.pass = pass;
        this.type = type;
        this.label = label;
    }

    public int pass() {
        return pass;
    }

    /**
     * {@code delete}, {@code merge} or {@code mixed}.
     */
    public String type() {
        return type;
    }

    public String label() {
        return label;
    }

    public static PassLabel forPass(int pass) {
        return Arrays.stream(values())
                .filter(l -> l.pass == pass)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown pass: " + pass));
    }
}
