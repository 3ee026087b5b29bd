package com.batchanalytics.domain.exception;

/**
 * Filter text outside the accepted {@code column OP value [AND|OR ...]} grammar.
 */
public class InvalidFilterPredicateException extends RuleDefinitionException {

    public InvalidFilterPredicateException(String ruleId, String message) {
        super(ruleId, "Rule " + ruleId + ": invalid filter predicate: " + message);
    }
}
