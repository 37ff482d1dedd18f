package com.geocompliance.rules;

/**
 * Thrown when a rule submitted for addition has logic that does not parse.
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String ruleId, String reason) {
        super("rule " + ruleId + " has invalid logic: " + reason);
    }
}
