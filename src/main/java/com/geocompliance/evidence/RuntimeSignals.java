package com.geocompliance.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Typed view of {@code signals.runtime}. A null persona means the simulated user is unknown.
 */
public record RuntimeSignals(
    Persona persona,
    List<String> blockedActions,
    List<String> uiStates,
    List<FlagResolution> flagResolutions,
    List<NetworkTrace> network,
    String traceUri
) {

    public RuntimeSignals {
        blockedActions = blockedActions == null ? List.of() : List.copyOf(blockedActions);
        uiStates = uiStates == null ? List.of() : List.copyOf(uiStates);
        flagResolutions = flagResolutions == null ? List.of() : List.copyOf(flagResolutions);
        network = network == null ? List.of() : List.copyOf(network);
    }

    public static RuntimeSignals empty() {
        return new RuntimeSignals(null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return persona == null && blockedActions.isEmpty() && uiStates.isEmpty()
            && flagResolutions.isEmpty() && network.isEmpty() && traceUri == null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Persona(
        @JsonProperty("country") String country,
        @JsonProperty("age") Integer age,
        @JsonProperty("region") String region,
        @JsonProperty("language") String language
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlagResolution(
        @JsonProperty("name") String name,
        @JsonProperty("value") Object value,
        @JsonProperty("source") String source
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NetworkTrace(
        @JsonProperty("host") String host,
        @JsonProperty("region_hint") String regionHint,
        @JsonProperty("method") String method,
        @JsonProperty("path") String path
    ) {}
}
