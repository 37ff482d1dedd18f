package com.geocompliance.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything collected for one feature: static scanner findings and runtime
 * probe observations under {@code signals.static} / {@code signals.runtime}.
 *
 * {@code signals} is kept as an open nested map so rule paths can address
 * fields the typed views ({@link StaticSignals}, {@link RuntimeSignals}) do not model.
 * {@code feature_id} is the join key between evidence, rules result and final record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidencePack(
    @JsonProperty("feature_id") String featureId,
    @JsonProperty("signals") Map<String, Object> signals,
    @JsonProperty("attachments") List<EvidenceAttachment> attachments,
    @JsonProperty("metadata") EvidenceMetadata metadata
) {

    public static final String STATIC = "static";
    public static final String RUNTIME = "runtime";

    public EvidencePack {
        signals = signals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(signals));
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        metadata = metadata == null ? EvidenceMetadata.empty() : metadata;
    }

    public static EvidencePack of(String featureId, Map<String, Object> staticSignals,
                                  Map<String, Object> runtimeSignals) {
        Map<String, Object> signals = new LinkedHashMap<>();
        if (staticSignals != null) {
            signals.put(STATIC, staticSignals);
        }
        if (runtimeSignals != null) {
            signals.put(RUNTIME, runtimeSignals);
        }
        return new EvidencePack(featureId, signals, List.of(), null);
    }

    /**
     * @return the named signal sub-tree, or an empty map when it is absent or not an object
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> signalTree(String name) {
        Object tree = signals.get(name);
        return tree instanceof Map ? (Map<String, Object>) tree : Map.of();
    }

    public boolean hasSignals(String name) {
        return !signalTree(name).isEmpty();
    }
}
