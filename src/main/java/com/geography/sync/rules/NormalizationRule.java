package com.geography.sync.rules;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One rewrite applied to unit names before matching. Most rules strip an
 * administrative designation ("Nagarpalika", "Ward No."); a few clean up
 * punctuation and spacing. Lower priorities run first.
 *
 * <p>A rule may be limited to a range of hierarchy levels, for tenants whose
 * designations only mean something at one depth of the tree.</p>
 *
 * @param minLevel first level the rule applies to, inclusive
 * @param maxLevel last level the rule applies to, inclusive
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority,
                                int minLevel, int maxLevel) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        if (minLevel < 0 || maxLevel < minLevel) {
            throw new IllegalArgumentException("Invalid level range " + minLevel + ".." + maxLevel + " for rule " + name);
        }
    }

    /**
     * Removes whole-word designations. Words inside a term may be run together
     * or spaced ("upa maha nagarpalika" also matches "Upamahanagarpalika").
     * List compound terms before the terms they contain.
     */
    public static NormalizationRule designations(String name, int priority, String... terms) {
        if (terms.length == 0) {
            throw new IllegalArgumentException("Rule " + name + " needs at least one designation");
        }
        String alternatives = Arrays.stream(terms)
                .map(term -> Arrays.stream(term.trim().split("\\s+"))
                        .map(Pattern::quote)
                        .collect(Collectors.joining("\\s*")))
                .collect(Collectors.joining("|"));
        return regex(name, priority, "\\b(" + alternatives + ")\\b", " ");
    }

    /**
     * A free-form rewrite, applied at every level.
     */
    public static NormalizationRule regex(String name, int priority, String regex, String replacement) {
        return new NormalizationRule(name, Pattern.compile(regex, FLAGS), replacement, priority, 0, Integer.MAX_VALUE);
    }

    /**
     * Copy of this rule limited to levels {@code minLevel..maxLevel}.
     */
    public NormalizationRule atLevels(int minLevel, int maxLevel) {
        return new NormalizationRule(name, pattern, replacement, priority, minLevel, maxLevel);
    }

    public boolean appliesTo(int level) {
        return level >= minLevel && level <= maxLevel;
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }
}
