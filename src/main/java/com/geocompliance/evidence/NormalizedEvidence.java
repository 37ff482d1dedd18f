package com.geocompliance.evidence;

import java.util.Map;

/**
 * Flat evaluation context for one feature plus the typed signal views it was built from.
 *
 * The context has three roots: {@code static}, {@code runtime} and {@code metadata}.
 */
public record NormalizedEvidence(
    String featureId,
    Map<String, Object> context,
    StaticSignals staticSignals,
    RuntimeSignals runtimeSignals
) {}
