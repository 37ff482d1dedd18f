package com.geocompliance.rules;

public class UnknownRuleException extends RuntimeException {

    public UnknownRuleException(String ruleId) {
        super("rule not found in catalog: " + ruleId);
    }
}
