package com.geocompliance.api;

import com.geocompliance.evidence.EvidenceContractValidator;
import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.pipeline.CompliancePipeline;
import com.geocompliance.pipeline.Evaluation;
import com.geocompliance.pipeline.EvidenceStore;
import com.geocompliance.pipeline.PipelineSummary;
import com.geocompliance.rules.RulesResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class EvaluationController {

    private final CompliancePipeline pipeline;
    private final EvidenceStore evidenceStore;
    private final EvidenceContractValidator validator;

    public EvaluationController(CompliancePipeline pipeline, EvidenceStore evidenceStore,
                                EvidenceContractValidator validator) {
        this.pipeline = pipeline;
        this.evidenceStore = evidenceStore;
        this.validator = validator;
    }

    /**
     * Evaluates a submitted evidence pack; nothing is stored.
     */
    @PostMapping("/evaluations")
    public Evaluation evaluate(@RequestBody EvidencePack evidence) {
        return pipeline.evaluate(evidence);
    }

    @PutMapping("/features/{featureId}/evidence")
    public Map<String, Object> storeEvidence(@PathVariable String featureId, @RequestBody EvidencePack evidence) {
        if (!featureId.equals(evidence.featureId())) {
            throw new IllegalArgumentException(
                "feature_id " + evidence.featureId() + " does not match path feature " + featureId);
        }
        validator.validate(evidence);
        evidenceStore.saveEvidence(evidence);
        return Map.of("status", "stored", "feature_id", featureId);
    }

    @PostMapping("/features/{featureId}/evaluation")
    public Evaluation evaluateStored(@PathVariable String featureId) {
        return pipeline.runFeature(featureId);
    }

    @GetMapping("/features/{featureId}/rules-result")
    public RulesResult rulesResult(@PathVariable String featureId) {
        return evidenceStore.loadRulesResult(featureId);
    }

    /**
     * Expected request body: {@code {"feature_ids": ["feat-1", "feat-2"]}}.
     */
    @PostMapping("/pipeline/runs")
    public PipelineSummary run(@RequestBody Map<String, Object> request) {
        Object ids = request.get("feature_ids");
        if (!(ids instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalArgumentException("feature_ids must be a non-empty array");
        }
        List<String> featureIds = new ArrayList<>(list.size());
        for (Object id : list) {
            if (!(id instanceof String featureId)) {
                throw new IllegalArgumentException("feature_ids must contain only strings, got " + id);
            }
            featureIds.add(featureId);
        }
        return pipeline.run(featureIds);
    }
}
