package com.geocompliance.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.EvidenceFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleCatalogTest {

    private final ObjectMapper mapper = EvidenceFixtures.objectMapper();

    private List<String> ids(RuleCatalog catalog) {
        return catalog.rules().stream().map(ComplianceRule::id).toList();
    }

    @Test
    void duplicateIdsAreRejected() {
        List<ComplianceRule> rules = new ArrayList<>(DefaultComplianceRules.defaults());
        rules.add(rules.get(0));
        assertThrows(DuplicateRuleException.class, () -> RuleCatalog.of(rules));
    }

    @Test
    @DisplayName("Toggling a rule keeps its position")
    void toggleKeepsOrder() {
        RuleCatalog catalog = RuleCatalog.of(DefaultComplianceRules.defaults());
        RuleCatalog toggled = catalog.withEnabled(DefaultComplianceRules.NCMEC_REPORTING, false);

        assertEquals(ids(catalog), ids(toggled));
        assertFalse(toggled.find(DefaultComplianceRules.NCMEC_REPORTING).orElseThrow().enabled());
        assertTrue(catalog.find(DefaultComplianceRules.NCMEC_REPORTING).orElseThrow().enabled());
    }

    @Test
    void toggleUnknownRuleFails() {
        assertThrows(UnknownRuleException.class, () -> RuleCatalog.empty().withEnabled("NOPE", true));
    }

    @Test
    void addedRuleGoesLast() throws Exception {
        ComplianceRule rule = new ComplianceRule("NEW_RULE", "New", mapper.readTree("{\"==\": [1, 1]}"),
            null, null, Severity.LOW, null, true);
        RuleCatalog updated = RuleCatalog.of(DefaultComplianceRules.defaults()).withRule(rule);

        assertEquals(6, updated.size());
        assertEquals("NEW_RULE", ids(updated).get(5));
    }

    @Test
    void addingInvalidOrDuplicateRuleFails() throws Exception {
        RuleCatalog catalog = RuleCatalog.of(DefaultComplianceRules.defaults());
        ComplianceRule invalid = new ComplianceRule("BROKEN", null, mapper.readTree("{\"nope\": []}"),
            null, null, null, null, true);
        ComplianceRule duplicate = DefaultComplianceRules.defaults().get(0);

        assertThrows(InvalidRuleException.class, () -> catalog.withRule(invalid));
        assertThrows(DuplicateRuleException.class, () -> catalog.withRule(duplicate));
        assertEquals(5, catalog.size());
    }

    @Test
    void defaultsAllCompile() {
        RuleCatalog catalog = RuleCatalog.of(DefaultComplianceRules.defaults());
        assertTrue(catalog.entries().stream().allMatch(CompiledRule::isCompiled));
    }

    @Test
    void documentDefaultsApply() throws Exception {
        ComplianceRule rule = mapper.readValue("{\"id\": \"R\", \"logic\": true}", ComplianceRule.class);
        assertEquals("R", rule.name());
        assertEquals(Severity.MEDIUM, rule.severity());
        assertTrue(rule.enabled());
        assertEquals(List.of(), rule.requiresControls());
    }
}
