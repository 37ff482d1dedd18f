package com.geocompliance.pipeline;

import com.geocompliance.evidence.ComplianceDocumentException;
import com.geocompliance.evidence.EvidenceContractValidator;
import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.rules.RuleCatalog;
import com.geocompliance.rules.RuleCatalogService;
import com.geocompliance.rules.RulesEngine;
import com.geocompliance.rules.RulesResult;
import com.geocompliance.synthesis.DecisionSource;
import com.geocompliance.synthesis.DecisionSynthesizer;
import com.geocompliance.synthesis.FinalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Load, evaluate, explain and persist, feature by feature.
 *
 * A batch uses one catalog snapshot for all of its features. A failure on one
 * feature produces an error record for it and never stops the batch.
 */
public class CompliancePipeline {

    private static final Logger log = LoggerFactory.getLogger(CompliancePipeline.class);

    private final EvidenceStore store;
    private final EvidenceContractValidator validator;
    private final RuleCatalogService catalogService;
    private final RulesEngine rulesEngine;
    private final DecisionSynthesizer synthesizer;

    public CompliancePipeline(EvidenceStore store,
                              EvidenceContractValidator validator,
                              RuleCatalogService catalogService,
                              RulesEngine rulesEngine,
                              DecisionSynthesizer synthesizer) {
        this.store = store;
        this.validator = validator;
        this.catalogService = catalogService;
        this.rulesEngine = rulesEngine;
        this.synthesizer = synthesizer;
    }

    public PipelineSummary run(List<String> featureIds) {
        RuleCatalog catalog = catalogService.current();
        List<FinalRecord> records = new ArrayList<>(featureIds.size());
        int errors = 0;

        for (String featureId : featureIds) {
            FinalRecord record;
            try {
                record = process(featureId, catalog).finalRecord();
            } catch (ComplianceDocumentException | IllegalArgumentException ex) {
                log.error("Failed to process feature {}: {}", featureId, ex.getMessage());
                record = recordFailure(featureId, ex);
            } catch (RuntimeException ex) {
                log.error("Unexpected failure processing feature {}", featureId, ex);
                record = recordFailure(featureId, ex);
            }
            if (record.decisionSource() == DecisionSource.ERROR) {
                errors++;
            }
            records.add(record);
        }

        log.info("Pipeline run complete: {} features, {} processed, {} errors",
            featureIds.size(), featureIds.size() - errors, errors);
        return new PipelineSummary(featureIds.size(), featureIds.size() - errors, errors, records);
    }

    /**
     * Runs one stored feature against the current catalog. Failures propagate.
     */
    public Evaluation runFeature(String featureId) {
        return process(featureId, catalogService.current());
    }

    /**
     * Evaluates a submitted pack against the current catalog without persisting anything.
     */
    public Evaluation evaluate(EvidencePack evidence) {
        validator.validate(evidence);
        RulesResult result = rulesEngine.evaluate(evidence, catalogService.current());
        return new Evaluation(result, synthesizer.synthesize(evidence, result));
    }

    private Evaluation process(String featureId, RuleCatalog catalog) {
        EvidencePack evidence = store.loadEvidence(featureId);
        validator.validate(evidence, featureId);

        RulesResult result = rulesEngine.evaluate(evidence, catalog);
        store.saveRulesResult(result);

        FinalRecord record = synthesizer.synthesize(evidence, result);
        store.saveFinalRecord(record);
        log.info("Feature {} processed: requires_geo_logic={} confidence={} source={}",
            featureId, record.requiresGeoLogic(), record.confidence(), record.decisionSource().getValue());
        return new Evaluation(result, record);
    }

    private FinalRecord recordFailure(String featureId, Exception cause) {
        FinalRecord error = FinalRecord.error(featureId, cause.getMessage());
        try {
            store.saveFinalRecord(error);
        } catch (ComplianceDocumentException | IllegalArgumentException ex) {
            log.warn("Could not persist error record for feature {}: {}", featureId, ex.getMessage());
        }
        return error;
    }
}
