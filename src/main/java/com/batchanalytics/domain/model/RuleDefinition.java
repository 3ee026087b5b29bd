package com.batchanalytics.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Validated snapshot of one aggregation rule, taken when rules are loaded for a tick.
 *
 * Rows that fail validation never become a RuleDefinition; see
 * {@link com.batchanalytics.domain.service.RuleDefinitionFactory}.
 */
@Value
@Builder
public class RuleDefinition {

    @NonNull String ruleId;
    @NonNull String tableName;
    @Singular List<String> metricNames;
    @NonNull AggregationFunction aggregation;
    @NonNull Granularity granularity;
    @NonNull String scheduleName;

    /** Null when the rule aggregates the whole table. */
    FilterPredicate filterPredicate;

    /** Original predicate text, kept for logs. */
    String filterText;

    public String metricNameLabel() {
        return String.join(",", metricNames);
    }
}
