package com.geography.sync.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Nested
    @DisplayName("Administrative designations")
    class AdministrativeTests {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource({
                "'Ward No. 32', '32'",
                "'ward number 5', '5'",
                "'Wada 7', '7'",
                "'Lalitpur Sub-Metropolitan City', 'lalitpur'",
                "'Kathmandu Metropolitan City', 'kathmandu'",
                "'Kirtipur Nagarpalika', 'kirtipur'",
                "'Shankharapur Rural Municipality', 'shankharapur'",
                "'Budhanilkantha Municipality', 'budhanilkantha'",
                "'Bagmati Pradesh', 'bagmati'",
                "'Koshi Province', 'koshi'",
                "'Nuwakot District', 'nuwakot'",
                "'Janakpur Zone', 'janakpur'",
                "'Thamel Tole', 'thamel'",
                "'Sankhu VDC', 'sankhu'"
        })
        void stripsDesignations(String input, String expected) {
            assertEquals(expected, engine.normalize(input));
        }

        @Test
        @DisplayName("Rural municipality is removed whole, not only its last word")
        void compoundBeforeParts() {
            assertEquals("dakshinkali", engine.normalize("Dakshinkali Rural Municipality"));
        }
    }

    @Nested
    @DisplayName("Generic cleanup")
    class CleanupTests {

        @Test
        void caseFoldsAndTrims() {
            assertEquals("kathmandu", engine.normalize("  KATHMANDU  "));
        }

        @Test
        void collapsesWhitespaceAndPunctuation() {
            assertEquals("new road", engine.normalize("New   Road,"));
        }

        @Test
        void appliesNfkc() {
            // fullwidth letters fold to ASCII
            assertEquals("patan", engine.normalize("ＰＡＴＡＮ"));
        }

        @Test
        void keepsNonLatinScripts() {
            String devanagari = "काठमाडौं";
            String normalized = engine.normalize(devanagari);
            assertFalse(normalized.isEmpty());
            assertEquals(normalized, engine.normalize(devanagari + "!"));
        }

        @Test
        @DisplayName("A name made only of noise words keeps its own text")
        void fallsBackWhenStrippedEmpty() {
            assertEquals("ward", engine.normalize("Ward"));
            assertEquals("municipality", engine.normalize("Municipality."));
        }

        @Test
        void blankIsEmpty() {
            assertEquals("", engine.normalize(null));
            assertEquals("", engine.normalize("   "));
        }
    }

    @Nested
    @DisplayName("Rule management")
    class RuleTests {

        @Test
        @DisplayName("A rule limited to a level range leaves other levels alone")
        void levelScopedRuleOnlyAppliesToItsLevels() {
            NormalizationEngine custom = new NormalizationEngine(List.of(
                    NormalizationRule.designations("strip-gaun", 20, "gaun").atLevels(4, 5)));

            assertEquals("sundar", custom.normalize("Sundar Gaun", 4));
            assertEquals("sundar", custom.normalize("Sundar Gaun", 5));
            assertEquals("sundar gaun", custom.normalize("Sundar Gaun", 3));
            assertEquals("sundar", custom.normalize("Sundar Gaun"));
        }

        @Test
        @DisplayName("Designation words may be written apart or run together")
        void designationSpacing() {
            NormalizationRule rule = NormalizationRule.designations("metro", 10, "upa maha nagarpalika");

            assertEquals("Lalitpur  ", rule.apply("Lalitpur Upamahanagarpalika"));
            assertEquals("Lalitpur  ", rule.apply("Lalitpur upa maha nagarpalika"));
            assertEquals("Mahanagar", rule.apply("Mahanagar"));
        }

        @Test
        @DisplayName("Designation terms are literal text, not patterns")
        void designationTermsAreQuoted() {
            NormalizationRule rule = NormalizationRule.designations("dotted", 10, "no.");

            assertEquals("ward no5", rule.apply("ward no5"));
        }

        @Test
        void invalidRulesAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> NormalizationRule.designations("empty", 10));
            assertThrows(IllegalArgumentException.class,
                    () -> NormalizationRule.designations("ward", 20, "ward").atLevels(3, 2));
        }

        @Test
        void rulesAreSortedByPriority() {
            NormalizationEngine custom = new NormalizationEngine();
            custom.addRule(NormalizationRule.regex("late", 50, "x", "y"));
            custom.addRule(NormalizationRule.regex("early", 1, "a", "x"));

            assertEquals(List.of("early", "late"), custom.getRules().stream().map(NormalizationRule::name).toList());
            assertEquals("y", custom.normalize("a"));
        }

        @Test
        void removeRuleByName() {
            assertTrue(engine.removeRule("admin-ward"));
            assertEquals("ward 32", engine.normalize("Ward 32"));
        }

        @Test
        void areEquivalentComparesNormalizedForms() {
            assertTrue(engine.areEquivalent("Ward No. 4", "WARD 4", 4));
            assertFalse(engine.areEquivalent("Ward 4", "Ward 5", 4));
        }
    }
}
