package com.geocompliance.synthesis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Short regulatory text known locally, linked to the rules it backs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicySnippet(
    @JsonProperty("regulation_id") String regulationId,
    @JsonProperty("title") String title,
    @JsonProperty("content") String content,
    @JsonProperty("source_url") String sourceUrl,
    @JsonProperty("jurisdiction") String jurisdiction,
    @JsonProperty("rule_ids") List<String> ruleIds
) {
    public PolicySnippet {
        ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
    }

    public boolean appliesTo(String ruleId) {
        return ruleIds.contains(ruleId) || (regulationId != null && regulationId.equalsIgnoreCase(ruleId));
    }
}
