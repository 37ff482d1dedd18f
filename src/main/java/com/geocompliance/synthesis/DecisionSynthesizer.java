package com.geocompliance.synthesis;

import com.geocompliance.evidence.EvidenceNormalizer;
import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.evidence.NormalizedEvidence;
import com.geocompliance.rules.RulesResult;
import com.geocompliance.rules.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Turns a {@link RulesResult} into a {@link FinalRecord}.
 *
 * When a collaborator is configured its answer is laid over the deterministic
 * record; any failure or invalid answer leaves the deterministic record as is.
 * The verdict fields ({@code requires_geo_logic}, {@code matched_rules},
 * {@code missing_controls}) always come from the rules result.
 */
public class DecisionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(DecisionSynthesizer.class);

    private final EvidenceNormalizer normalizer;
    private final FallbackSynthesizer fallback;
    private final PolicySnippetCatalog snippets;
    private final Optional<ReasoningCollaborator> collaborator;

    public DecisionSynthesizer(EvidenceNormalizer normalizer,
                               FallbackSynthesizer fallback,
                               PolicySnippetCatalog snippets,
                               Optional<ReasoningCollaborator> collaborator) {
        this.normalizer = normalizer;
        this.fallback = fallback;
        this.snippets = snippets;
        this.collaborator = collaborator;
    }

    public FinalRecord synthesize(EvidencePack evidence, RulesResult result) {
        NormalizedEvidence normalized = normalizer.normalize(evidence);
        FinalRecord deterministic = fallback.synthesize(normalized, result);
        if (collaborator.isEmpty()) {
            return deterministic;
        }

        ReasoningRequest request = new ReasoningRequest(normalized, result, snippets.relevantFor(result.matchedRules()));
        try {
            ReasoningResponse response = collaborator.get().explain(request);
            FinalRecord refined = overlay(deterministic, response);
            log.info("Reasoning collaborator explained feature {}", result.featureId());
            return refined;
        } catch (RuntimeException ex) {
            log.warn("Reasoning collaborator failed for feature {}, using deterministic record: {}",
                result.featureId(), ex.getMessage());
            return deterministic;
        }
    }

    private FinalRecord overlay(FinalRecord base, ReasoningResponse response) {
        if (response == null) {
            throw new ReasoningException("collaborator returned no answer");
        }
        double confidence = base.confidence();
        if (response.confidence() != null) {
            confidence = response.confidence();
            if (!(confidence >= 0.0 && confidence <= 1.0)) {
                throw new ReasoningException("confidence out of range: " + confidence);
            }
        }
        Severity severity = base.severity();
        if (response.severity() != null) {
            try {
                severity = Severity.fromValue(response.severity());
            } catch (IllegalArgumentException ex) {
                throw new ReasoningException(ex.getMessage(), ex);
            }
        }
        return new FinalRecord(
            base.featureId(),
            base.requiresGeoLogic(),
            response.reasoning() != null ? response.reasoning() : base.reasoning(),
            response.relatedRegulations() != null ? response.relatedRegulations() : base.relatedRegulations(),
            confidence,
            base.matchedRules(),
            base.missingControls(),
            response.evidenceRefs() != null ? response.evidenceRefs() : base.evidenceRefs(),
            response.codeRefs() != null ? response.codeRefs() : base.codeRefs(),
            response.runtimeObservation() != null ? response.runtimeObservation() : base.runtimeObservation(),
            response.needsReview() != null ? response.needsReview() : base.needsReview(),
            severity,
            DecisionSource.COLLABORATOR,
            Instant.now()
        );
    }
}
