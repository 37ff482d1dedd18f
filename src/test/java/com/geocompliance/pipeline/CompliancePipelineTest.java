package com.geocompliance.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.EvidenceFixtures;
import com.geocompliance.evidence.EvidenceContractValidator;
import com.geocompliance.evidence.EvidenceNormalizer;
import com.geocompliance.evidence.EvidenceNotFoundException;
import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.evidence.MalformedDocumentException;
import com.geocompliance.logic.ExpressionEvaluator;
import com.geocompliance.rules.DefaultComplianceRules;
import com.geocompliance.rules.RuleCatalogService;
import com.geocompliance.rules.RuleCatalogStore;
import com.geocompliance.rules.RulesEngine;
import com.geocompliance.synthesis.DecisionSource;
import com.geocompliance.synthesis.DecisionSynthesizer;
import com.geocompliance.synthesis.FallbackSynthesizer;
import com.geocompliance.synthesis.FinalRecord;
import com.geocompliance.synthesis.PolicySnippetCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CompliancePipelineTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = EvidenceFixtures.objectMapper();
    private Path evidenceDir;
    private FileEvidenceStore store;
    private RuleCatalogService catalogService;
    private CompliancePipeline pipeline;

    @BeforeEach
    void setUp() {
        evidenceDir = tempDir.resolve("evidence");
        store = new FileEvidenceStore(evidenceDir, mapper);
        catalogService = RuleCatalogService.initialize(
            new RuleCatalogStore(tempDir.resolve("rules.json"), mapper));

        EvidenceNormalizer normalizer = new EvidenceNormalizer(mapper);
        PolicySnippetCatalog snippets = PolicySnippetCatalog.builtIn();
        DecisionSynthesizer synthesizer = new DecisionSynthesizer(
            normalizer, new FallbackSynthesizer(snippets), snippets, Optional.empty());
        pipeline = new CompliancePipeline(store, new EvidenceContractValidator(), catalogService,
            new RulesEngine(normalizer, new ExpressionEvaluator()), synthesizer);
    }

    @Nested
    @DisplayName("Batch runs")
    class BatchRuns {

        @Test
        void processesEveryFeatureAndPersistsResults() {
            store.saveEvidence(EvidenceFixtures.utahMinor("feat-utah"));
            store.saveEvidence(EvidenceFixtures.ncmecReporter("feat-ncmec"));

            PipelineSummary summary = pipeline.run(List.of("feat-utah", "feat-ncmec"));

            assertEquals(2, summary.total());
            assertEquals(2, summary.processed());
            assertEquals(0, summary.errors());
            assertEquals(List.of("feat-utah", "feat-ncmec"),
                summary.records().stream().map(FinalRecord::featureId).toList());
            assertTrue(Files.exists(evidenceDir.resolve("feat-utah_rules_result.json")));
            assertTrue(Files.exists(evidenceDir.resolve("feat-ncmec_final_record.json")));
            assertEquals(List.of(DefaultComplianceRules.NCMEC_REPORTING),
                store.loadRulesResult("feat-ncmec").matchedRules());
        }

        @Test
        void missingEvidenceYieldsErrorRecordAndBatchContinues() throws Exception {
            store.saveEvidence(EvidenceFixtures.utahMinor("feat-ok"));

            PipelineSummary summary = pipeline.run(List.of("feat-missing", "feat-ok"));

            assertEquals(1, summary.errors());
            assertEquals(1, summary.processed());
            FinalRecord error = summary.records().get(0);
            assertEquals(DecisionSource.ERROR, error.decisionSource());
            assertEquals(0.0, error.confidence());
            assertTrue(error.needsReview());
            assertTrue(Files.exists(evidenceDir.resolve("feat-missing_final_record.json")));
            assertEquals(DecisionSource.FALLBACK, summary.records().get(1).decisionSource());
        }

        @Test
        void malformedAndMismatchedEvidenceAreErrors() throws Exception {
            Files.createDirectories(evidenceDir);
            Files.writeString(evidenceDir.resolve("feat-bad.json"), "not json");
            store.saveEvidence(EvidenceFixtures.empty("feat-other"));
            Files.move(evidenceDir.resolve("feat-other.json"), evidenceDir.resolve("feat-renamed.json"));

            PipelineSummary summary = pipeline.run(List.of("feat-bad", "feat-renamed", "../escape"));

            assertEquals(3, summary.errors());
            assertTrue(summary.records().stream().allMatch(r -> r.decisionSource() == DecisionSource.ERROR));
        }

        @Test
        void catalogEditsDoNotAffectARunningSnapshot() {
            store.saveEvidence(EvidenceFixtures.utahMinor("feat-utah"));
            catalogService.setEnabled(DefaultComplianceRules.UT_MINORS_CURFEW, false);

            PipelineSummary summary = pipeline.run(List.of("feat-utah"));
            assertFalse(summary.records().get(0).requiresGeoLogic());
        }
    }

    @Nested
    @DisplayName("Single evaluations")
    class SingleEvaluations {

        @Test
        void inMemoryEvaluationWritesNothing() {
            Evaluation evaluation = pipeline.evaluate(EvidenceFixtures.utahMinor("feat-mem"));

            assertTrue(evaluation.rulesResult().requiresGeoLogic());
            assertEquals(evaluation.rulesResult().matchedRules(), evaluation.finalRecord().matchedRules());
            assertFalse(Files.exists(evidenceDir));
        }

        @Test
        void inMemoryEvaluationValidatesShape() {
            EvidencePack invalid = EvidencePack.of("feat-bad", java.util.Map.of("tags", "x"), null);
            assertThrows(MalformedDocumentException.class, () -> pipeline.evaluate(invalid));
        }

        @Test
        void storedFeatureFailuresPropagate() {
            assertThrows(EvidenceNotFoundException.class, () -> pipeline.runFeature("feat-none"));
        }

        @Test
        void storedFeatureIsPersisted() {
            store.saveEvidence(EvidenceFixtures.euUserData("feat-eu"));
            Evaluation evaluation = pipeline.runFeature("feat-eu");
            assertEquals(List.of(DefaultComplianceRules.GDPR_DATA_PROCESSING),
                evaluation.rulesResult().matchedRules());
            assertTrue(Files.exists(evidenceDir.resolve("feat-eu_final_record.json")));
        }
    }
}
