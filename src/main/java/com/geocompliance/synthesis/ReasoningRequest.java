package com.geocompliance.synthesis;

import com.geocompliance.evidence.NormalizedEvidence;
import com.geocompliance.rules.RulesResult;

import java.util.List;

public record ReasoningRequest(
    NormalizedEvidence evidence,
    RulesResult rulesResult,
    List<PolicySnippet> policySnippets
) {
    public ReasoningRequest {
        policySnippets = policySnippets == null ? List.of() : List.copyOf(policySnippets);
    }
}
