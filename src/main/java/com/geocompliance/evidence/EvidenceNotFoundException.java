package com.geocompliance.evidence;

/**
 * Thrown when the document referenced by a feature id does not exist.
 */
public class EvidenceNotFoundException extends ComplianceDocumentException {

    private final String featureId;

    public EvidenceNotFoundException(String featureId, String location) {
        super("document not found for feature " + featureId + ": " + location);
        this.featureId = featureId;
    }

    public String getFeatureId() {
        return featureId;
    }
}
