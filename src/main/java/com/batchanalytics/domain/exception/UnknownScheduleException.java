package com.batchanalytics.domain.exception;

public class UnknownScheduleException extends RuleDefinitionException {

    public UnknownScheduleException(String ruleId, String scheduleName) {
        super(ruleId, "Rule " + ruleId + ": no schedule mapped for '" + scheduleName + "'");
    }
}
