package com.geocompliance.api;

import com.geocompliance.evidence.DocumentWriteException;
import com.geocompliance.evidence.EvidenceNotFoundException;
import com.geocompliance.evidence.MalformedDocumentException;
import com.geocompliance.rules.DuplicateRuleException;
import com.geocompliance.rules.InvalidRuleException;
import com.geocompliance.rules.UnknownRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error body for every endpoint:
 * <pre>
 * {
 *   "error_code": "MALFORMED_DOCUMENT",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EvidenceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(EvidenceNotFoundException ex) {
        return errorResponse("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(MalformedDocumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleMalformed(MalformedDocumentException ex) {
        log.warn("Malformed document: {}", ex.getMessage());
        return errorResponse("MALFORMED_DOCUMENT", ex.getMessage());
    }

    @ExceptionHandler(UnknownRuleException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownRule(UnknownRuleException ex) {
        return errorResponse("UNKNOWN_RULE", ex.getMessage());
    }

    @ExceptionHandler(DuplicateRuleException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateRule(DuplicateRuleException ex) {
        log.warn("Duplicate rule: {}", ex.getMessage());
        return errorResponse("DUPLICATE_RULE", ex.getMessage());
    }

    @ExceptionHandler(InvalidRuleException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRule(InvalidRuleException ex) {
        return errorResponse("INVALID_RULE", ex.getMessage());
    }

    @ExceptionHandler(DocumentWriteException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleWriteFailure(DocumentWriteException ex) {
        log.error("Document write failed", ex);
        return errorResponse("WRITE_FAILED", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
