package com.geocompliance.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file or trace attached to an evidence pack; type is one of code, config or trace.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceAttachment(
    @JsonProperty("type") String type,
    @JsonProperty("uri") String uri,
    @JsonProperty("description") String description
) {}
