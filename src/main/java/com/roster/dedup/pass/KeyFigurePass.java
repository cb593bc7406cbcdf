package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.rules.VariantRule;
import com.roster.dedup.rules.VariantRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Pass 4: merges known spelling variants of high-profile individuals and deletes their known
 * junk variants. A protected name is never deleted, even when the table lists it.
 */
public class KeyFigurePass extends VariantTablePass {
    private static final Logger log = LoggerFactory.getLogger(KeyFigurePass.class);

    static final String MERGE_REASON = "key figure variant";

    public KeyFigurePass(VariantRuleSet rules) {
        super(rules);
    }

    @Override
    public int number() {
        return 4;
    }

    @Override
    public String name() {
        return "key figure variants";
    }

    @Override
    protected String mergeReason() {
        return MERGE_REASON;
    }

    @Override
    protected int applyDeletes(PassContext context, VariantRule rule, Person canonical) {
        if (rule.deleteNames().isEmpty()) {
            return 0;
        }
        List<Person> targets = findAll(context, rule.deleteNames(), canonical).stream()
                .filter(p -> {
                    if (context.isProtected(p)) {
                        log.info("pass4.protected name='{}'", p.getName());
                        return false;
                    }
                    return true;
                })
                .toList();
        if (targets.isEmpty()) {
            return 0;
        }
        int removed = context.delete(number(), "junk variant of " + rule.canonical(), targets);
        log.debug("pass4.delete canonical='{}' count={}", rule.canonical(), removed);
        return removed;
    }
}
