package com.batchanalytics.domain.exception;

/**
 * Missing or blank mandatory field on a stored rule.
 */
public class InvalidRuleDefinitionException extends RuleDefinitionException {

    public InvalidRuleDefinitionException(String ruleId, String message) {
        super(ruleId, "Rule " + ruleId + ": " + message);
    }
}
