package com.geocompliance.synthesis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Answer from a reasoning collaborator. Every field is optional; absent fields
 * keep the deterministic value. {@code requires_geo_logic}, {@code matched_rules}
 * and {@code missing_controls} are not accepted from a collaborator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReasoningResponse(
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("related_regulations") List<String> relatedRegulations,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("evidence_refs") List<String> evidenceRefs,
    @JsonProperty("code_refs") List<String> codeRefs,
    @JsonProperty("runtime_observation") String runtimeObservation,
    @JsonProperty("needs_review") Boolean needsReview,
    @JsonProperty("severity") String severity
) {}
