package com.geocompliance.synthesis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.geocompliance.rules.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Explainable verdict for one feature, built once per pipeline pass and never
 * updated; a re-run supersedes it. {@code code_refs} holds at most
 * {@value #MAX_CODE_REFS} entries.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FinalRecord(
    @JsonProperty("feature_id") String featureId,
    @JsonProperty("requires_geo_logic") boolean requiresGeoLogic,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("related_regulations") List<String> relatedRegulations,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("matched_rules") List<String> matchedRules,
    @JsonProperty("missing_controls") @JsonDeserialize(as = LinkedHashSet.class) Set<String> missingControls,
    @JsonProperty("evidence_refs") List<String> evidenceRefs,
    @JsonProperty("code_refs") List<String> codeRefs,
    @JsonProperty("runtime_observation") String runtimeObservation,
    @JsonProperty("needs_review") boolean needsReview,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("decision_source") DecisionSource decisionSource,
    @JsonProperty("created_at") Instant createdAt
) {

    public static final int MAX_CODE_REFS = 10;

    public FinalRecord {
        reasoning = reasoning == null ? "" : reasoning;
        relatedRegulations = relatedRegulations == null ? List.of() : List.copyOf(relatedRegulations);
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
        missingControls = missingControls == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(missingControls));
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
        codeRefs = codeRefs == null ? List.of() : List.copyOf(codeRefs.subList(0, Math.min(codeRefs.size(), MAX_CODE_REFS)));
        runtimeObservation = runtimeObservation == null ? "" : runtimeObservation;
        severity = severity == null ? Severity.MEDIUM : severity;
        createdAt = createdAt == null ? Instant.now() : createdAt;
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
    }

    /**
     * Record written for a feature whose evidence could not be processed.
     */
    public static FinalRecord error(String featureId, String message) {
        return new FinalRecord(
            featureId,
            false,
            "Processing failed: " + message,
            List.of(),
            0.0,
            List.of(),
            Set.of(),
            List.of(),
            List.of(),
            "",
            true,
            Severity.CRITICAL,
            DecisionSource.ERROR,
            Instant.now()
        );
    }
}
