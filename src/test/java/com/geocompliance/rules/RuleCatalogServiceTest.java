package com.geocompliance.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.EvidenceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RuleCatalogServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = EvidenceFixtures.objectMapper();
    private RuleCatalogStore store;
    private RuleCatalogService service;

    @BeforeEach
    void setUp() {
        store = new RuleCatalogStore(tempDir.resolve("compliance_rules.json"), mapper);
        service = RuleCatalogService.initialize(store);
    }

    @Test
    void disablePersistsAndPublishes() {
        RuleCatalog before = service.current();
        service.setEnabled(DefaultComplianceRules.UT_MINORS_CURFEW, false);

        assertFalse(service.current().find(DefaultComplianceRules.UT_MINORS_CURFEW).orElseThrow().enabled());
        assertTrue(before.find(DefaultComplianceRules.UT_MINORS_CURFEW).orElseThrow().enabled(),
            "snapshots taken earlier are unaffected");
        assertFalse(store.read().find(DefaultComplianceRules.UT_MINORS_CURFEW).orElseThrow().enabled());
    }

    @Test
    void addRulePersists() throws Exception {
        ComplianceRule rule = new ComplianceRule("KR_GAME_SHUTDOWN", "Korean shutdown law",
            mapper.readTree("{\"==\": [{\"var\": \"runtime.persona.country\"}, \"KR\"]}"),
            null, null, Severity.HIGH, null, true);
        service.addRule(rule);

        assertEquals(6, service.current().size());
        assertTrue(store.read().find("KR_GAME_SHUTDOWN").isPresent());
    }

    @Test
    void failedEditsLeaveCatalogUntouched() throws Exception {
        ComplianceRule duplicate = DefaultComplianceRules.defaults().get(1);
        assertThrows(DuplicateRuleException.class, () -> service.addRule(duplicate));
        assertThrows(UnknownRuleException.class, () -> service.setEnabled("MISSING", false));
        assertEquals(5, service.current().size());
        assertEquals(5, store.read().size());
    }
}
