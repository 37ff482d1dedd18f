package com.geocompliance.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geocompliance.rules.RulesResult;
import com.geocompliance.synthesis.FinalRecord;

public record Evaluation(
    @JsonProperty("rules_result") RulesResult rulesResult,
    @JsonProperty("final_record") FinalRecord finalRecord
) {}
