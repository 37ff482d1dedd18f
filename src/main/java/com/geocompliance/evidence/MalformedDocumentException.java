package com.geocompliance.evidence;

/**
 * Thrown when a document exists but cannot be parsed or fails validation.
 */
public class MalformedDocumentException extends ComplianceDocumentException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
