package com.roster.dedup.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads variant tables from JSON, either from the bundled classpath defaults or from a file.
 *
 * <pre>
 * {
 *   "version": "2024-06-01",
 *   "rules": [
 *     {"canonical": "Glenn Dubin", "variants": ["Glen Dubin"]},
 *     {"canonical": "Ghislaine Maxwell", "variants": ["G. Maxwell"], "deleteNames": ["Ghislaine Maxwel"]}
 *   ]
 * }
 * </pre>
 */
public class VariantRuleLoader {
    private static final Logger log = LoggerFactory.getLogger(VariantRuleLoader.class);

    /** Bundled key-figure table used by pass 4. */
    public static final String KEY_FIGURES_RESOURCE = "rules/key-figures.json";

    /** Bundled OCR and nickname table used by pass 6. */
    public static final String OCR_NICKNAMES_RESOURCE = "rules/ocr-nicknames.json";

    private final ObjectMapper objectMapper;

    public VariantRuleLoader() {
        this(new ObjectMapper());
    }

    public VariantRuleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public VariantRuleSet loadKeyFigures() {
        return loadResource(KEY_FIGURES_RESOURCE);
    }

    public VariantRuleSet loadOcrNicknames() {
        return loadResource(OCR_NICKNAMES_RESOURCE);
    }

    /**
     * Loads a rule set from the classpath.
     *
     * @throws RuleLoadException if the resource is missing or malformed
     */
    public VariantRuleSet loadResource(String resource) {
        try (InputStream in = VariantRuleLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RuleLoadException("Variant rule resource not found: " + resource);
            }
            VariantRuleSet ruleSet = objectMapper.readValue(in, VariantRuleSet.class);
            log.info("variant.rules.loaded source={} version={} rules={}",
                    resource, ruleSet.version(), ruleSet.size());
            return ruleSet;
        } catch (IOException e) {
            throw new RuleLoadException("Malformed variant rule resource: " + resource, e);
        }
    }

    /**
     * Loads a rule set from a file.
     *
     * @throws RuleLoadException if the file is missing or malformed
     */
    public VariantRuleSet load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new RuleLoadException("Variant rule file not found: " + path);
        }
        try {
            VariantRuleSet ruleSet = objectMapper.readValue(path.toFile(), VariantRuleSet.class);
            log.info("variant.rules.loaded source={} version={} rules={}",
                    path, ruleSet.version(), ruleSet.size());
            return ruleSet;
        } catch (IOException e) {
            throw new RuleLoadException("Malformed variant rule file: " + path, e);
        }
    }
}
