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

class EvidenceContractValidatorTest {

    private EvidenceContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new EvidenceContractValidator();
    }

    @Nested
    @DisplayName("Accepted packs")
    class Accepted {

        @Test
        void fixturesAreValid() {
            assertDoesNotThrow(() -> validator.validate(EvidenceFixtures.utahMinor("feat-1")));
            assertDoesNotThrow(() -> validator.validate(EvidenceFixtures.ncmecReporter("feat-2")));
            assertDoesNotThrow(() -> validator.validate(EvidenceFixtures.empty("feat-3")));
        }

        @Test
        void missingSignalTreesAreAllowed() {
            EvidencePack pack = new EvidencePack("feat-4", null, null, null);
            assertDoesNotThrow(() -> validator.validate(pack));
        }
    }

    @Nested
    @DisplayName("Rejected packs")
    class Rejected {

        @Test
        void blankFeatureId() {
            MalformedDocumentException ex = assertThrows(MalformedDocumentException.class,
                () -> validator.validate(EvidenceFixtures.empty(" ")));
            assertTrue(ex.getMessage().contains("feature_id"));
        }

        @Test
        void staticTreeMustBeObject() {
            EvidencePack pack = new EvidencePack("feat-5", Map.of("static", List.of()), null, null);
            assertThrows(MalformedDocumentException.class, () -> validator.validate(pack));
        }

        @Test
        void listFieldMustBeArray() {
            EvidencePack pack = EvidencePack.of("feat-6", Map.of("tags", "user_data"), null);
            MalformedDocumentException ex = assertThrows(MalformedDocumentException.class,
                () -> validator.validate(pack));
            assertTrue(ex.getMessage().contains("tags"));
        }

        @Test
        void booleanFieldMustBeBoolean() {
            EvidencePack pack = EvidencePack.of("feat-7", Map.of("reco_system", "yes"), null);
            assertThrows(MalformedDocumentException.class, () -> validator.validate(pack));
        }

        @Test
        void personaAgeMustBePlausible() {
            Map<String, Object> runtime = new LinkedHashMap<>();
            runtime.put("persona", Map.of("country", "US", "age", 200));
            EvidencePack pack = EvidencePack.of("feat-8", null, runtime);
            assertThrows(MalformedDocumentException.class, () -> validator.validate(pack));

            runtime.put("persona", Map.of("country", "US", "age", "sixteen"));
            EvidencePack textual = EvidencePack.of("feat-8", null, runtime);
            assertThrows(MalformedDocumentException.class, () -> validator.validate(textual));
        }

        @Test
        void featureIdMustMatchLookupKey() {
            EvidencePack pack = EvidenceFixtures.empty("feat-a");
            assertThrows(MalformedDocumentException.class, () -> validator.validate(pack, "feat-b"));
            assertDoesNotThrow(() -> validator.validate(pack, "feat-a"));
        }
    }
}
