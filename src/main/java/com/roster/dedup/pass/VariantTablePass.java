package com.roster.dedup.pass;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.rules.VariantRule;
import com.roster.dedup.rules.VariantRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies a curated variant table: each variant spelling found among live persons is merged
 * into the row matching the rule's canonical spelling. Names match ignoring case. A rule whose
 * canonical row is absent is skipped.
 */
public abstract class VariantTablePass implements DeduplicationPass {
    private static final Logger log = LoggerFactory.getLogger(VariantTablePass.class);

    private final VariantRuleSet rules;

    protected VariantTablePass(VariantRuleSet rules) {
        this.rules = rules;
    }

    protected abstract String mergeReason();

    /**
     * Handles the rule's delete list once its variants are merged.
     *
     * @return number of persons deleted or proposed for deletion
     */
    protected int applyDeletes(PassContext context, VariantRule rule, Person canonical) {
        return 0;
    }

    @Override
    public PassResult run(PassContext context) {
        int failuresBefore = context.getFailures();
        int merged = 0;
        int deleted = 0;
        int rulesMatched = 0;
        for (VariantRule rule : rules.rules()) {
            Optional<Person> canonicalOpt = context.findLiveByNameIgnoreCase(rule.canonical());
            if (canonicalOpt.isEmpty()) {
                log.debug("pass{}.rule.skipped canonical='{}' reason=absent", number(), rule.canonical());
                continue;
            }
            Person canonical = canonicalOpt.get();
            rulesMatched++;

            for (String variant : rule.variants()) {
                Optional<Person> row = context.findLiveByNameIgnoreCase(variant);
                if (row.isEmpty() || row.get().getId() == canonical.getId()) {
                    continue;
                }
                Person duplicate = row.get();
                if (context.merge(number(), mergeReason(), canonical, List.of(duplicate),
                        List.of(duplicate.getName()), null)) {
                    merged++;
                    log.debug("pass{}.merge variant='{}' canonical='{}'",
                            number(), duplicate.getName(), canonical.getName());
                }
            }
            deleted += applyDeletes(context, rule, canonical);
        }
        log.info("pass{}.completed rulesVersion={} rulesMatched={} merged={} deleted={}",
                number(), rules.version(), rulesMatched, merged, deleted);
        return new PassResult(number(), name(), merged + deleted, merged + deleted, 0,
                context.getFailures() - failuresBefore, Duration.ZERO);
    }

    /**
     * Live persons named in {@code names}, excluding the canonical row.
     */
    protected List<Person> findAll(PassContext context, List<String> names, Person canonical) {
        List<Person> found = new ArrayList<>();
        for (String name : names) {
            context.findLiveByNameIgnoreCase(name)
                    .filter(p -> p.getId() != canonical.getId())
                    .filter(p -> !found.contains(p))
                    .ifPresent(found::add);
        }
        return found;
    }
}
