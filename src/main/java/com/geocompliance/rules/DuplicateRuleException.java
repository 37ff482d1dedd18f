package com.geocompliance.rules;

/**
 * Thrown when a rule id is already present in the catalog. Ids are never reused.
 */
public class DuplicateRuleException extends RuntimeException {

    public DuplicateRuleException(String ruleId) {
        super("rule id already exists: " + ruleId);
    }
}
