package com.roster.dedup.pass;

import com.roster.dedup.rules.VariantRuleSet;

/**
 * Pass 6: merges known OCR misreadings and nicknames into their canonical spelling.
 */
public class OcrNicknamePass extends VariantTablePass {

    static final String MERGE_REASON = "OCR/nickname variant";

    public OcrNicknamePass(VariantRuleSet rules) {
        super(rules);
    }

    @Override
    public int number() {
        return 6;
    }

    @Override
    public String name() {
        return "OCR/nickname";
    }

    @Override
    protected String mergeReason() {
        return MERGE_REASON;
    }
}
