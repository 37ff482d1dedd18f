package com.geocompliance.synthesis;

import com.geocompliance.EvidenceFixtures;
import com.geocompliance.evidence.EvidenceNormalizer;
import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.evidence.NormalizedEvidence;
import com.geocompliance.logic.ExpressionEvaluator;
import com.geocompliance.rules.DefaultComplianceRules;
import com.geocompliance.rules.RuleCatalog;
import com.geocompliance.rules.RulesEngine;
import com.geocompliance.rules.RulesResult;
import com.geocompliance.rules.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FallbackSynthesizerTest {

    private EvidenceNormalizer normalizer;
    private RulesEngine engine;
    private RuleCatalog catalog;
    private FallbackSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        normalizer = new EvidenceNormalizer(EvidenceFixtures.objectMapper());
        engine = new RulesEngine(normalizer, new ExpressionEvaluator());
        catalog = RuleCatalog.of(DefaultComplianceRules.defaults());
        synthesizer = new FallbackSynthesizer(PolicySnippetCatalog.builtIn());
    }

    private FinalRecord synthesize(EvidencePack pack) {
        RulesResult result = engine.evaluate(pack, catalog);
        NormalizedEvidence normalized = normalizer.normalize(pack);
        return synthesizer.synthesize(normalized, result);
    }

    @Test
    @DisplayName("Utah minor: reasoning, references and review flag")
    void utahMinorRecord() {
        FinalRecord record = synthesize(EvidenceFixtures.utahMinor("feat-utah"));

        assertEquals("Geographic branching detected in 1 locations with countries: US, UT. "
            + "Age verification systems found using ageverify. "
            + "Compliance rules triggered: UT_MINORS_CURFEW", record.reasoning());
        assertEquals(List.of("Utah Social Media Regulation Act - Minor Protections"), record.relatedRegulations());
        assertEquals(List.of("src/curfew.py:42", "src/age.py:7"), record.codeRefs());
        assertEquals(List.of("evidence/feat-utah.json"), record.evidenceRefs());
        assertEquals("Persona US, age 16, region UT; Blocked actions: post_after_curfew; UI states: curfew_banner",
            record.runtimeObservation());
        assertTrue(record.requiresGeoLogic());
        assertTrue(record.needsReview());
        assertEquals(Severity.HIGH, record.severity());
        assertEquals(DecisionSource.FALLBACK, record.decisionSource());
        assertEquals(List.of("curfew_enforcement", "age_verification"), new ArrayList<>(record.missingControls()));
    }

    @Test
    void sameInputsGiveSameReasoning() {
        EvidencePack pack = EvidenceFixtures.ncmecReporter("feat-pure");
        assertEquals(synthesize(pack).reasoning(), synthesize(pack).reasoning());
    }

    @Test
    void emptyEvidenceHasLimitedIndicators() {
        FinalRecord record = synthesize(EvidenceFixtures.empty("feat-empty"));

        assertEquals(FallbackSynthesizer.NO_INDICATORS, record.reasoning());
        assertEquals("", record.runtimeObservation());
        assertEquals(List.of(), record.relatedRegulations());
        assertEquals(Severity.MEDIUM, record.severity());
        assertFalse(record.requiresGeoLogic());
        assertTrue(record.needsReview());
    }

    @Test
    void dataResidencyRegionsAreListed() {
        FinalRecord record = synthesize(EvidenceFixtures.euUserData("feat-eu"));
        assertTrue(record.reasoning().startsWith("Data residency patterns detected for regions: eu-west"));
        assertEquals(List.of("GDPR - Lawful Basis for Processing"), record.relatedRegulations());
    }

    @Test
    void ageCheckLibrariesAreDistinctInFirstSeenOrder() {
        Map<String, Object> statics = new LinkedHashMap<>();
        statics.put("age_checks", List.of(
            Map.of("file", "a", "line", 1, "lib", "zeta"),
            Map.of("file", "b", "line", 2, "lib", "alpha"),
            Map.of("file", "c", "line", 3, "lib", "zeta")));
        FinalRecord record = synthesize(EvidencePack.of("feat-libs", statics, null));
        assertEquals("Age verification systems found using zeta, alpha", record.reasoning());
    }

    @Test
    void codeRefsAreCappedAtTen() {
        List<Map<String, Object>> geo = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            geo.add(Map.of("file", "geo.py", "line", i, "countries", List.of("US")));
        }
        FinalRecord record = synthesize(EvidencePack.of("feat-many", Map.of("geo_branching", geo), null));

        assertEquals(FinalRecord.MAX_CODE_REFS, record.codeRefs().size());
        assertEquals("geo.py:1", record.codeRefs().get(0));
        assertEquals("geo.py:10", record.codeRefs().get(9));
    }

    @Test
    void highConfidenceSkipsReview() {
        RulesResult confident = new RulesResult("feat-c", true, 0.8, List.of("NCMEC_REPORTING"),
            null, null, null);
        FinalRecord record = synthesizer.synthesize(
            normalizer.normalize(EvidenceFixtures.ncmecReporter("feat-c")), confident);
        assertFalse(record.needsReview());
        assertEquals(0.8, record.confidence());
    }

    @Test
    void errorRecordShape() {
        FinalRecord error = FinalRecord.error("feat-x", "evidence missing");
        assertEquals(0.0, error.confidence());
        assertTrue(error.needsReview());
        assertEquals(Severity.CRITICAL, error.severity());
        assertEquals(DecisionSource.ERROR, error.decisionSource());
        assertTrue(error.reasoning().contains("evidence missing"));
    }
}
