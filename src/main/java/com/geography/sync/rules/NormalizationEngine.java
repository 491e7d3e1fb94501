package com.geography.sync.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Engine for applying normalization rules to geography unit names.
 * Rules are applied in priority order (lower priority number = higher precedence).
 *
 * <p>If the rules strip a name down to nothing (a unit literally called "Ward"),
 * the case-folded, punctuation-free form of the input is returned instead.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\s]");

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.name().equals(ruleName));
    }

    /**
     * Gets all rules currently in the engine.
     */
    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes the given name applying rules of every level.
     */
    public String normalize(String name) {
        return normalize(name, null);
    }

    /**
     * Normalizes the given name for a specific hierarchy level.
     * Applies rules in priority order, filtering by level.
     */
    public String normalize(String name, Integer level) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = Normalizer.normalize(name, Normalizer.Form.NFKC);

        for (NormalizationRule rule : rules) {
            if (level == null || rule.appliesTo(level)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
                }
            }
        }

        result = clean(result);
        if (result.isEmpty()) {
            result = clean(PUNCTUATION.matcher(Normalizer.normalize(name, Normalizer.Form.NFKC)).replaceAll(" "));
        }
        return result;
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2, Integer level) {
        return normalize(name1, level).equals(normalize(name2, level));
    }

    private static String clean(String value) {
        return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }
}
