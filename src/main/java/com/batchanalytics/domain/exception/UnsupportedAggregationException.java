package com.batchanalytics.domain.exception;

public class UnsupportedAggregationException extends RuleDefinitionException {

    public UnsupportedAggregationException(String ruleId, String aggregation) {
        super(ruleId, "Rule " + ruleId + ": unsupported aggregation '" + aggregation + "'");
    }
}
