package com.geography.sync.rules;

import java.util.List;

/**
 * Built-in rules stripping punctuation and the administrative designations
 * tenants attach to unit names ("Ward No. 32", "Lalitpur Sub-Metropolitan City",
 * "Bagmati Pradesh"). English and romanized Nepali designations are covered.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getAdministrativeRules());
        return engine;
    }

    /**
     * Rules that apply to every name regardless of level.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Punctuation to space, keeping letters of every script
                NormalizationRule.regex("common-punctuation", 5, "[^\\p{L}\\p{M}\\p{N}\\s]", " "),
                NormalizationRule.regex("common-collapse-spaces", 200, "\\s+", " ")
        );
    }

    /**
     * Administrative noise words in English and romanized Nepali. Compound
     * designations run before their parts so "rural municipality" is removed whole.
     * They apply at every level: tenants do not agree on the depth at which a
     * ward or a zone sits.
     */
    public static List<NormalizationRule> getAdministrativeRules() {
        return List.of(
                NormalizationRule.designations("admin-metropolitan", 10,
                        "sub metropolitan city", "metropolitan city", "upa maha nagarpalika", "maha nagarpalika"),
                NormalizationRule.designations("admin-rural-municipality", 10, "rural municipality", "gaun palika"),
                NormalizationRule.designations("admin-vdc", 10, "village development committee", "vdc"),
                NormalizationRule.designations("admin-municipality", 20, "municipality", "nagar palika"),
                NormalizationRule.designations("admin-ward", 20, "ward number", "ward no", "ward", "wada", "woda"),
                NormalizationRule.designations("admin-district", 20, "district", "jilla"),
                NormalizationRule.designations("admin-province", 20, "province", "pradesh"),
                NormalizationRule.designations("admin-zone", 20, "zone", "anchal"),
                NormalizationRule.designations("admin-tole", 20, "tole")
        );
    }
}
