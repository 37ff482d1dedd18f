package com.geocompliance.synthesis;

/**
 * The reasoning collaborator failed or produced an unusable answer.
 */
public class ReasoningException extends RuntimeException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
