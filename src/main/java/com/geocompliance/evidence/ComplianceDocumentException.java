package com.geocompliance.evidence;

/**
 * Base class for failures reading or writing the documents the engine works
 * on (evidence packs, rule catalogs, results). Fatal for a single feature, never for a batch.
 */
public abstract class ComplianceDocumentException extends RuntimeException {

    protected ComplianceDocumentException(String message) {
        super(message);
    }

    protected ComplianceDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
