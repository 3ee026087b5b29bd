package com.batchanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Rule exactly as supplied by the external loaders, before validation.
 *
 * {@code metricName} may list several metrics separated by commas.
 */
@Value
@Builder
public class RuleRecord {

    String ruleId;
    String tableName;
    String metricName;
    String aggregation;
    String granularity;
    String scheduleName;
    String filterPredicate;
}
