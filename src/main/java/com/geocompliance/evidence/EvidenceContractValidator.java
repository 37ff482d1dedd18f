package com.geocompliance.evidence;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Structural validation of an incoming {@link EvidencePack}.
 *
 * Only the document shape is checked here: a non-blank feature_id, object
 * sub-trees, list and boolean fields where the static/runtime schema defines
 * them. Absent fields are always allowed; the normalizer fills their defaults.
 */
@Component
public class EvidenceContractValidator {

    private static final List<String> STATIC_LISTS = List.of(
        "geo_branching", "age_checks", "data_residency", "reporting_clients", "flags", "tags");
    private static final List<String> STATIC_BOOLEANS = List.of("reco_system", "pf_controls");
    private static final List<String> RUNTIME_LISTS = List.of(
        "blocked_actions", "ui_states", "flag_resolutions", "network");

    public void validate(EvidencePack evidence) {
        requireNonNull(evidence, "evidence cannot be null");
        requireString(evidence.featureId(), "feature_id is required");

        Object staticTree = evidence.signals().get(EvidencePack.STATIC);
        if (staticTree != null) {
            Map<?, ?> signals = requireObject(staticTree, "signals.static must be an object");
            for (String field : STATIC_LISTS) {
                requireListIfPresent(signals.get(field), "signals.static." + field + " must be an array");
            }
            for (String field : STATIC_BOOLEANS) {
                Object value = signals.get(field);
                if (value != null && !(value instanceof Boolean)) {
                    throw new MalformedDocumentException("signals.static." + field + " must be a boolean");
                }
            }
        }

        Object runtimeTree = evidence.signals().get(EvidencePack.RUNTIME);
        if (runtimeTree != null) {
            Map<?, ?> signals = requireObject(runtimeTree, "signals.runtime must be an object");
            for (String field : RUNTIME_LISTS) {
                requireListIfPresent(signals.get(field), "signals.runtime." + field + " must be an array");
            }
            Object persona = signals.get("persona");
            if (persona != null) {
                validatePersona(requireObject(persona, "signals.runtime.persona must be an object"));
            }
        }
    }

    /**
     * Validates the pack and checks it belongs to the feature it was looked up by.
     */
    public void validate(EvidencePack evidence, String expectedFeatureId) {
        validate(evidence);
        if (!evidence.featureId().equals(expectedFeatureId)) {
            throw new MalformedDocumentException(
                "feature_id " + evidence.featureId() + " does not match requested feature " + expectedFeatureId);
        }
    }

    private void validatePersona(Map<?, ?> persona) {
        Object age = persona.get("age");
        if (age == null) {
            return;
        }
        if (!(age instanceof Number number)) {
            throw new MalformedDocumentException("signals.runtime.persona.age must be a number");
        }
        if (number.doubleValue() < 0 || number.doubleValue() > 150) {
            throw new MalformedDocumentException("signals.runtime.persona.age must be between 0 and 150");
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new MalformedDocumentException(message);
        }
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new MalformedDocumentException(message);
        }
        return text;
    }

    private Map<?, ?> requireObject(Object value, String message) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new MalformedDocumentException(message);
        }
        return map;
    }

    private void requireListIfPresent(Object value, String message) {
        if (value != null && !(value instanceof List<?>)) {
            throw new MalformedDocumentException(message);
        }
    }
}
