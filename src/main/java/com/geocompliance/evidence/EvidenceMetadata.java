package com.geocompliance.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Provenance of an evidence pack. Not used by rule evaluation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceMetadata(
    @JsonProperty("repo") String repo,
    @JsonProperty("commit") String commit,
    @JsonProperty("branch") String branch,
    @JsonProperty("scan_timestamp") Instant scanTimestamp,
    @JsonProperty("scanner_version") String scannerVersion
) {
    public static EvidenceMetadata empty() {
        return new EvidenceMetadata(null, null, null, null, null);
    }
}
