package com.geocompliance.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Typed view of {@code signals.static}. Every field defaults to empty / false.
 */
public record StaticSignals(
    List<GeoSignal> geoBranching,
    List<AgeCheckSignal> ageChecks,
    List<DataResidencySignal> dataResidency,
    List<String> reportingClients,
    boolean recoSystem,
    boolean pfControls,
    List<FlagSignal> flags,
    List<String> tags
) {

    public StaticSignals {
        geoBranching = geoBranching == null ? List.of() : List.copyOf(geoBranching);
        ageChecks = ageChecks == null ? List.of() : List.copyOf(ageChecks);
        dataResidency = dataResidency == null ? List.of() : List.copyOf(dataResidency);
        reportingClients = reportingClients == null ? List.of() : List.copyOf(reportingClients);
        flags = flags == null ? List.of() : List.copyOf(flags);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static StaticSignals empty() {
        return new StaticSignals(null, null, null, null, false, false, null, null);
    }

    public boolean isEmpty() {
        return geoBranching.isEmpty() && ageChecks.isEmpty() && dataResidency.isEmpty()
            && reportingClients.isEmpty() && !recoSystem && !pfControls
            && flags.isEmpty() && tags.isEmpty();
    }

    /** A code location that branches on a list of country codes. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeoSignal(
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("countries") List<String> countries,
        @JsonProperty("message") String message
    ) {
        public GeoSignal {
            countries = countries == null ? List.of() : List.copyOf(countries);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AgeCheckSignal(
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("lib") String lib,
        @JsonProperty("method") String method,
        @JsonProperty("message") String message
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DataResidencySignal(
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("region") String region,
        @JsonProperty("service") String service,
        @JsonProperty("message") String message
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlagSignal(
        @JsonProperty("name") String name,
        @JsonProperty("file") String file,
        @JsonProperty("line") Integer line
    ) {}
}
