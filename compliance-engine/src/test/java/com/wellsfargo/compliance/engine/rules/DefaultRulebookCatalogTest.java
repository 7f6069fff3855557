package com.wellsfargo.compliance.engine.rules;

import com.wellsfargo.compliance.canonical.Rule;
import com.wellsfargo.compliance.canonical.enums.RuleProvenance;
import com.wellsfargo.compliance.canonical.enums.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultRulebookCatalogTest {

    private final DefaultRulebookCatalog catalog = new DefaultRulebookCatalog();

    @Test
    public void testBundledSchemes() {
        assertTrue(catalog.hasScheme("SEPA"));
        assertTrue(catalog.hasScheme("swift_mt103"));
        assertTrue(catalog.hasScheme("CHAPS"));
        assertTrue(catalog.hasScheme("SIX"));
        assertFalse(catalog.hasScheme("FEDWIRE"));
        assertFalse(catalog.hasScheme(null));
    }

    @Test
    public void testRulebookTextMentionsPurposeCodeThreshold() {
        String text = catalog.getRulebookText("SEPA").orElseThrow();

        assertTrue(text.contains("AT-44"));
        assertTrue(text.contains("12,500"));
        assertFalse(catalog.getRulebookText("FEDWIRE").isPresent());
    }

    @Test
    public void testDefaultRulesAreStampedAsDefault() {
        List<Rule> rules = catalog.createDefaultRules("sepa");

        assertFalse(rules.isEmpty());
        assertEquals("AT-44", rules.get(0).getId());
        assertEquals(Severity.HIGH, rules.get(0).getSeverity());
        for (Rule rule : rules) {
            assertEquals("SEPA", rule.getScheme());
            assertEquals(RuleProvenance.DEFAULT, rule.getProvenance());
            assertNotNull(rule.getCreatedAt());
            assertNotNull(rule.getCategory());
        }
        assertTrue(catalog.createDefaultRules("FEDWIRE").isEmpty());
    }

    @Test
    public void testMissingCatalogueFailsLoudly() {
        assertThrows(IllegalStateException.class, () -> new DefaultRulebookLoader().load("/config/missing.json"));
    }
}
