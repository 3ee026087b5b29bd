package com.batchanalytics.domain.exception;

public class UnsupportedGranularityException extends RuleDefinitionException {

    public UnsupportedGranularityException(String ruleId, String granularity) {
        super(ruleId, "Rule " + ruleId + ": unsupported granularity '" + granularity + "'");
    }
}
