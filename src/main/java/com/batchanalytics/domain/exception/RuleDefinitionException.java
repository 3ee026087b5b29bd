package com.batchanalytics.domain.exception;

import lombok.Getter;

/**
 * A rule definition that cannot be scheduled or turned into a query.
 *
 * Definition errors affect only the offending rule: it is logged and skipped, never
 * retried.
 */
@Getter
public abstract class RuleDefinitionException extends RuntimeException {

    private final String ruleId;

    protected RuleDefinitionException(String ruleId, String message) {
        super(message);
        this.ruleId = ruleId;
    }
}
