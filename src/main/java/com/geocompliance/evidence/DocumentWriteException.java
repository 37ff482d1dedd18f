package com.geocompliance.evidence;

public class DocumentWriteException extends ComplianceDocumentException {

    public DocumentWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
