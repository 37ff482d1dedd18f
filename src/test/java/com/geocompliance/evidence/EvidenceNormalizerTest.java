package com.geocompliance.evidence;

import com.geocompliance.EvidenceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceNormalizerTest {

    private EvidenceNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EvidenceNormalizer(EvidenceFixtures.objectMapper());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> tree(NormalizedEvidence evidence, String root) {
        return (Map<String, Object>) evidence.context().get(root);
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        void emptyEvidenceGetsEveryDefault() {
            NormalizedEvidence normalized = normalizer.normalize(EvidenceFixtures.empty("feat-empty"));

            Map<String, Object> statics = tree(normalized, "static");
            for (String field : List.of("geo_branching", "age_checks", "data_residency",
                "reporting_clients", "flags", "tags", "all_countries", "all_regions")) {
                assertEquals(List.of(), statics.get(field), field);
            }
            assertEquals(false, statics.get("reco_system"));
            assertEquals(false, statics.get("pf_controls"));

            @SuppressWarnings("unchecked")
            Map<String, Object> persona = (Map<String, Object>) tree(normalized, "runtime").get("persona");
            assertEquals(EvidenceNormalizer.UNKNOWN_COUNTRY, persona.get("country"));
            assertTrue(persona.containsKey("age"));
            assertNull(persona.get("age"));
            assertNull(normalized.runtimeSignals().persona());
        }

        @Test
        void emptyPersonaIsReplacedBySentinel() {
            EvidencePack pack = EvidencePack.of("feat-p", Map.of(), Map.of("persona", Map.of()));
            @SuppressWarnings("unchecked")
            Map<String, Object> persona = (Map<String, Object>) tree(normalizer.normalize(pack), "runtime").get("persona");
            assertEquals("Unknown", persona.get("country"));
        }

        @Test
        void metadataRootIsPresent() {
            NormalizedEvidence normalized = normalizer.normalize(EvidenceFixtures.empty("feat-m"));
            assertTrue(tree(normalized, "metadata").containsKey("commit"));
        }
    }

    @Nested
    @DisplayName("Derived fields")
    class Derived {

        @Test
        void allCountriesIsOrderedUnion() {
            Map<String, Object> statics = new LinkedHashMap<>();
            statics.put("geo_branching", List.of(
                Map.of("file", "a", "line", 1, "countries", List.of("US", "UT")),
                Map.of("file", "b", "line", 2, "countries", List.of("UT", "CA"))));
            statics.put("data_residency", List.of(
                Map.of("file", "c", "line", 3, "region", "eu-west"),
                Map.of("file", "d", "line", 4, "region", "eu-west")));

            NormalizedEvidence normalized = normalizer.normalize(EvidencePack.of("feat-d", statics, null));

            assertEquals(List.of("US", "UT", "CA"), tree(normalized, "static").get("all_countries"));
            assertEquals(List.of("eu-west"), tree(normalized, "static").get("all_regions"));
        }

        @Test
        void unknownFieldsArePreservedForRulePaths() {
            EvidencePack pack = EvidencePack.of("feat-x", Map.of("custom_signal", "on"), null);
            assertEquals("on", tree(normalizer.normalize(pack), "static").get("custom_signal"));
        }
    }

    @Nested
    @DisplayName("Typed views")
    class TypedViews {

        @Test
        void readsSignalsIntoRecords() {
            NormalizedEvidence normalized = normalizer.normalize(EvidenceFixtures.utahMinor("feat-utah"));

            assertEquals(1, normalized.staticSignals().geoBranching().size());
            assertEquals(42, normalized.staticSignals().geoBranching().get(0).line());
            assertEquals("ageverify", normalized.staticSignals().ageChecks().get(0).lib());
            assertEquals(16, normalized.runtimeSignals().persona().age());
            assertEquals(List.of("post_after_curfew"), normalized.runtimeSignals().blockedActions());
        }

        @Test
        void malformedEntriesAreSkipped() {
            Map<String, Object> statics = new LinkedHashMap<>();
            statics.put("geo_branching", List.of(
                "not-an-object",
                Map.of("file", "a", "line", "not-a-number"),
                Map.of("file", "b", "line", 2, "countries", List.of("US"))));
            statics.put("flags", List.of("simple_flag", Map.of("name", "rich_flag", "file", "f.py")));

            NormalizedEvidence normalized = normalizer.normalize(EvidencePack.of("feat-bad", statics, null));

            assertEquals(1, normalized.staticSignals().geoBranching().size());
            assertEquals("b", normalized.staticSignals().geoBranching().get(0).file());
            assertEquals(List.of("simple_flag", "rich_flag"),
                normalized.staticSignals().flags().stream().map(StaticSignals.FlagSignal::name).toList());
        }

        @Test
        void inputPackIsNotModified() {
            EvidencePack pack = EvidenceFixtures.empty("feat-pure");
            normalizer.normalize(pack);
            assertEquals(Map.of(), pack.signalTree(EvidencePack.STATIC));
            assertEquals(Map.of(), pack.signalTree(EvidencePack.RUNTIME));
        }
    }
}
