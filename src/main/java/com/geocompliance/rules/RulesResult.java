package com.geocompliance.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of running a rule catalog against one feature's evidence.
 *
 * Invariants, checked on construction:
 * <ul>
 *   <li>{@code requires_geo_logic == !matched_rules.isEmpty()}</li>
 *   <li>{@code 0.0 <= confidence <= 1.0}</li>
 * </ul>
 * {@code matched_rules} is in catalog order; {@code missing_controls} is the
 * union of the matched rules' required controls in first-seen order.
 * {@code failed_rules} lists rules whose evaluation failed and were treated as non-matching.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RulesResult(
    @JsonProperty("feature_id") String featureId,
    @JsonProperty("requires_geo_logic") boolean requiresGeoLogic,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("matched_rules") List<String> matchedRules,
    @JsonProperty("missing_controls") @JsonDeserialize(as = LinkedHashSet.class) Set<String> missingControls,
    @JsonProperty("failed_rules") List<RuleFailure> failedRules,
    @JsonProperty("evaluation_timestamp") Instant evaluationTimestamp
) {

    public RulesResult {
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
        missingControls = missingControls == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(missingControls));
        failedRules = failedRules == null ? List.of() : List.copyOf(failedRules);

        if (requiresGeoLogic == matchedRules.isEmpty()) {
            throw new IllegalArgumentException("requires_geo_logic must be true exactly when rules matched");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleFailure(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("reason") String reason
    ) {}
}
