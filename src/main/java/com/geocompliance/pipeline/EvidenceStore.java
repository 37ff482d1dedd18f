package com.geocompliance.pipeline;

import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.rules.RulesResult;
import com.geocompliance.synthesis.FinalRecord;

/**
 * Keyed storage for the three per-feature documents. Feature ids are the only key.
 */
public interface EvidenceStore {

    /**
     * @throws com.geocompliance.evidence.EvidenceNotFoundException if there is no evidence for the feature
     * @throws com.geocompliance.evidence.MalformedDocumentException if the stored evidence cannot be parsed
     */
    EvidencePack loadEvidence(String featureId);

    void saveEvidence(EvidencePack evidence);

    RulesResult loadRulesResult(String featureId);

    void saveRulesResult(RulesResult result);

    void saveFinalRecord(FinalRecord record);
}
