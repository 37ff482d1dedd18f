package com.geocompliance.synthesis;

import com.geocompliance.evidence.NormalizedEvidence;
import com.geocompliance.evidence.RuntimeSignals;
import com.geocompliance.evidence.StaticSignals;
import com.geocompliance.rules.RulesResult;
import com.geocompliance.rules.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Deterministic explanation built only from the normalized evidence and the
 * rules result. Same inputs give the same record apart from {@code created_at}.
 */
public class FallbackSynthesizer {

    static final String NO_INDICATORS = "Limited compliance indicators found in evidence";
    static final double REVIEW_THRESHOLD = 0.7;

    private final PolicySnippetCatalog snippets;

    public FallbackSynthesizer(PolicySnippetCatalog snippets) {
        this.snippets = snippets;
    }

    public FinalRecord synthesize(NormalizedEvidence evidence, RulesResult result) {
        StaticSignals statics = evidence.staticSignals();
        return new FinalRecord(
            result.featureId(),
            result.requiresGeoLogic(),
            reasoning(statics, result),
            snippets.titlesFor(result.matchedRules()),
            result.confidence(),
            result.matchedRules(),
            result.missingControls(),
            List.of("evidence/" + result.featureId() + ".json"),
            codeRefs(statics),
            runtimeObservation(evidence.runtimeSignals()),
            result.confidence() < REVIEW_THRESHOLD,
            result.requiresGeoLogic() ? Severity.HIGH : Severity.MEDIUM,
            DecisionSource.FALLBACK,
            Instant.now()
        );
    }

    private String reasoning(StaticSignals statics, RulesResult result) {
        List<String> parts = new ArrayList<>();
        if (!statics.geoBranching().isEmpty()) {
            String countries = statics.geoBranching().stream()
                .map(signal -> String.join(", ", signal.countries()))
                .collect(Collectors.joining(", "));
            parts.add("Geographic branching detected in " + statics.geoBranching().size()
                + " locations with countries: " + countries);
        }
        if (!statics.ageChecks().isEmpty()) {
            LinkedHashSet<String> libs = new LinkedHashSet<>();
            statics.ageChecks().forEach(signal -> libs.add(String.valueOf(signal.lib())));
            parts.add("Age verification systems found using " + String.join(", ", libs));
        }
        if (!statics.dataResidency().isEmpty()) {
            String regions = statics.dataResidency().stream()
                .map(signal -> String.valueOf(signal.region()))
                .collect(Collectors.joining(", "));
            parts.add("Data residency patterns detected for regions: " + regions);
        }
        if (!result.matchedRules().isEmpty()) {
            parts.add("Compliance rules triggered: " + String.join(", ", result.matchedRules()));
        }
        return parts.isEmpty() ? NO_INDICATORS : String.join(". ", parts);
    }

    private List<String> codeRefs(StaticSignals statics) {
        List<String> refs = new ArrayList<>();
        statics.geoBranching().forEach(s -> refs.add(s.file() + ":" + s.line()));
        statics.ageChecks().forEach(s -> refs.add(s.file() + ":" + s.line()));
        statics.dataResidency().forEach(s -> refs.add(s.file() + ":" + s.line()));
        return refs.size() > FinalRecord.MAX_CODE_REFS ? refs.subList(0, FinalRecord.MAX_CODE_REFS) : refs;
    }

    private String runtimeObservation(RuntimeSignals runtime) {
        if (runtime.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        RuntimeSignals.Persona persona = runtime.persona();
        if (persona != null) {
            StringBuilder text = new StringBuilder("Persona ").append(persona.country());
            if (persona.age() != null) {
                text.append(", age ").append(persona.age());
            }
            if (persona.region() != null) {
                text.append(", region ").append(persona.region());
            }
            parts.add(text.toString());
        }
        if (!runtime.blockedActions().isEmpty()) {
            parts.add("Blocked actions: " + String.join(", ", runtime.blockedActions()));
        }
        if (!runtime.uiStates().isEmpty()) {
            parts.add("UI states: " + String.join(", ", runtime.uiStates()));
        }
        if (!runtime.flagResolutions().isEmpty()) {
            parts.add("Resolved flags: " + runtime.flagResolutions().stream()
                .map(flag -> flag.name() + "=" + flag.value())
                .collect(Collectors.joining(", ")));
        }
        if (!runtime.network().isEmpty()) {
            parts.add("Network hosts: " + runtime.network().stream()
                .map(RuntimeSignals.NetworkTrace::host)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.joining(", ")));
        }
        return String.join("; ", parts);
    }
}
