package com.geocompliance.evidence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the canonical evaluation context for an {@link EvidencePack}.
 *
 * <ul>
 *   <li>recognized static fields that are absent get their defaults (empty list / false)</li>
 *   <li>{@code static.all_countries}: union of every geo_branching countries list</li>
 *   <li>{@code static.all_regions}: union of every data_residency region</li>
 *   <li>a missing {@code runtime.persona} becomes the sentinel
 *       {@code {age: null, country: "Unknown", region: null}}</li>
 * </ul>
 *
 * Pure: the input pack is never modified and no input shape makes it throw.
 * Entries that do not fit their typed shape are left out of the typed views.
 */
@Component
public class EvidenceNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EvidenceNormalizer.class);

    public static final String UNKNOWN_COUNTRY = "Unknown";

    private static final List<String> STATIC_LIST_FIELDS = List.of(
        "geo_branching", "age_checks", "data_residency", "reporting_clients", "flags", "tags");
    private static final List<String> STATIC_FLAG_FIELDS = List.of("reco_system", "pf_controls");

    private final ObjectMapper objectMapper;

    public EvidenceNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NormalizedEvidence normalize(EvidencePack evidence) {
        Map<String, Object> rawStatic = evidence.signalTree(EvidencePack.STATIC);
        Map<String, Object> rawRuntime = evidence.signalTree(EvidencePack.RUNTIME);

        StaticSignals staticSignals = readStatic(rawStatic);
        RuntimeSignals runtimeSignals = readRuntime(rawRuntime);

        Map<String, Object> staticContext = new LinkedHashMap<>(rawStatic);
        for (String field : STATIC_LIST_FIELDS) {
            if (staticContext.get(field) == null) {
                staticContext.put(field, new ArrayList<>());
            }
        }
        for (String field : STATIC_FLAG_FIELDS) {
            if (staticContext.get(field) == null) {
                staticContext.put(field, false);
            }
        }
        staticContext.put("all_countries", allCountries(staticSignals));
        staticContext.put("all_regions", allRegions(staticSignals));

        Map<String, Object> runtimeContext = new LinkedHashMap<>(rawRuntime);
        Object persona = runtimeContext.get("persona");
        if (persona == null || (persona instanceof Map<?, ?> map && map.isEmpty())) {
            runtimeContext.put("persona", sentinelPersona());
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put(EvidencePack.STATIC, staticContext);
        context.put(EvidencePack.RUNTIME, runtimeContext);
        context.put("metadata", metadataTree(evidence));

        return new NormalizedEvidence(evidence.featureId(), context, staticSignals, runtimeSignals);
    }

    private StaticSignals readStatic(Map<String, Object> raw) {
        return new StaticSignals(
            readList(raw.get("geo_branching"), StaticSignals.GeoSignal.class),
            readList(raw.get("age_checks"), StaticSignals.AgeCheckSignal.class),
            readList(raw.get("data_residency"), StaticSignals.DataResidencySignal.class),
            readStrings(raw.get("reporting_clients")),
            Boolean.TRUE.equals(raw.get("reco_system")),
            Boolean.TRUE.equals(raw.get("pf_controls")),
            readFlags(raw.get("flags")),
            readStrings(raw.get("tags"))
        );
    }

    private RuntimeSignals readRuntime(Map<String, Object> raw) {
        RuntimeSignals.Persona persona = null;
        Object rawPersona = raw.get("persona");
        if (rawPersona instanceof Map<?, ?> map && !map.isEmpty()) {
            persona = convert(rawPersona, RuntimeSignals.Persona.class);
        }
        Object traceUri = raw.get("trace_uri");
        return new RuntimeSignals(
            persona,
            readStrings(raw.get("blocked_actions")),
            readStrings(raw.get("ui_states")),
            readList(raw.get("flag_resolutions"), RuntimeSignals.FlagResolution.class),
            readList(raw.get("network"), RuntimeSignals.NetworkTrace.class),
            traceUri instanceof String uri ? uri : null
        );
    }

    private <T> List<T> readList(Object raw, Class<T> type) {
        List<T> values = new ArrayList<>();
        if (!(raw instanceof Collection<?> entries)) {
            return values;
        }
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?>)) {
                log.debug("Skipping non-object {} entry: {}", type.getSimpleName(), entry);
                continue;
            }
            T value = convert(entry, type);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private List<StaticSignals.FlagSignal> readFlags(Object raw) {
        List<StaticSignals.FlagSignal> flags = new ArrayList<>();
        if (!(raw instanceof Collection<?> entries)) {
            return flags;
        }
        for (Object entry : entries) {
            if (entry instanceof String name) {
                flags.add(new StaticSignals.FlagSignal(name, null, null));
            } else if (entry instanceof Map<?, ?>) {
                StaticSignals.FlagSignal flag = convert(entry, StaticSignals.FlagSignal.class);
                if (flag != null) {
                    flags.add(flag);
                }
            }
        }
        return flags;
    }

    private List<String> readStrings(Object raw) {
        List<String> values = new ArrayList<>();
        if (raw instanceof Collection<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof String || entry instanceof Number || entry instanceof Boolean) {
                    values.add(String.valueOf(entry));
                }
            }
        }
        return values;
    }

    private <T> T convert(Object raw, Class<T> type) {
        try {
            return objectMapper.convertValue(raw, type);
        } catch (IllegalArgumentException ex) {
            log.debug("Skipping malformed {} entry: {}", type.getSimpleName(), ex.getMessage());
            return null;
        }
    }

    private List<String> allCountries(StaticSignals signals) {
        Set<String> countries = new LinkedHashSet<>();
        for (StaticSignals.GeoSignal geo : signals.geoBranching()) {
            for (String country : geo.countries()) {
                if (country != null) {
                    countries.add(country);
                }
            }
        }
        return new ArrayList<>(countries);
    }

    private List<String> allRegions(StaticSignals signals) {
        Set<String> regions = new LinkedHashSet<>();
        for (StaticSignals.DataResidencySignal residency : signals.dataResidency()) {
            if (residency.region() != null) {
                regions.add(residency.region());
            }
        }
        return new ArrayList<>(regions);
    }

    private Map<String, Object> metadataTree(EvidencePack evidence) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        EvidenceMetadata source = evidence.metadata();
        metadata.put("repo", source.repo());
        metadata.put("commit", source.commit());
        metadata.put("branch", source.branch());
        metadata.put("scan_timestamp", source.scanTimestamp() != null ? source.scanTimestamp().toString() : null);
        metadata.put("scanner_version", source.scannerVersion());
        return metadata;
    }

    private static Map<String, Object> sentinelPersona() {
        Map<String, Object> persona = new LinkedHashMap<>();
        persona.put("age", null);
        persona.put("country", UNKNOWN_COUNTRY);
        persona.put("region", null);
        return persona;
    }
}
