package com.geocompliance.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geocompliance.synthesis.FinalRecord;

import java.util.List;

/**
 * Outcome of a batch run: one record per requested feature, in request order.
 */
public record PipelineSummary(
    @JsonProperty("total") int total,
    @JsonProperty("processed") int processed,
    @JsonProperty("errors") int errors,
    @JsonProperty("records") List<FinalRecord> records
) {
    public PipelineSummary {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
