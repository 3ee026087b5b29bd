package com.batchanalytics.domain.service;

import com.batchanalytics.domain.exception.InvalidRuleDefinitionException;
import com.batchanalytics.domain.exception.UnknownScheduleException;
import com.batchanalytics.domain.exception.UnsupportedAggregationException;
import com.batchanalytics.domain.exception.UnsupportedGranularityException;
import com.batchanalytics.domain.model.AggregationFunction;
import com.batchanalytics.domain.model.Granularity;
import com.batchanalytics.domain.model.RuleCatalog;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.model.RuleRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Validates a stored rule against the catalog and turns it into a {@link RuleDefinition}.
 *
 * Unknown aggregations, granularities and schedules are rejected here, at load time,
 * so a malformed rule never reaches a worker.
 */
@Component
@RequiredArgsConstructor
public class RuleDefinitionFactory {

    private final RuleCatalog catalog;
    private final FilterPredicateParser filterParser;

    public RuleDefinition create(RuleRecord record) {
        String ruleId = record.getRuleId();
        if (ruleId == null || ruleId.isBlank()) {
            throw new InvalidRuleDefinitionException(String.valueOf(ruleId), "rule id is required");
        }
        String tableName = required(ruleId, "table name", record.getTableName());
        List<String> metrics = normalizeMetricNames(ruleId, record.getMetricName());

        AggregationFunction aggregation = AggregationFunction.fromCode(record.getAggregation())
                .filter(catalog::supports)
                .orElseThrow(() -> new UnsupportedAggregationException(ruleId, record.getAggregation()));

        Granularity granularity = catalog.granularity(record.getGranularity())
                .orElseThrow(() -> new UnsupportedGranularityException(ruleId, record.getGranularity()));

        String scheduleName = required(ruleId, "schedule name", record.getScheduleName());
        if (catalog.schedule(scheduleName).isEmpty()) {
            throw new UnknownScheduleException(ruleId, scheduleName);
        }

        return RuleDefinition.builder()
                .ruleId(ruleId)
                .tableName(tableName)
                .metricNames(metrics)
                .aggregation(aggregation)
                .granularity(granularity)
                .scheduleName(scheduleName)
                .filterPredicate(filterParser.parse(ruleId, record.getFilterPredicate()))
                .filterText(record.getFilterPredicate())
                .build();
    }

    /**
     * Metric names are matched against column names: lower case, dots become underscores.
     */
    static List<String> normalizeMetricNames(String ruleId, String metricName) {
        List<String> metrics = Arrays.stream(required(ruleId, "metric name", metricName).split(","))
                .map(String::trim)
                .filter(m -> !m.isEmpty())
                .map(m -> m.toLowerCase(Locale.ROOT).replace('.', '_'))
                .distinct()
                .toList();
        if (metrics.isEmpty()) {
            throw new InvalidRuleDefinitionException(ruleId, "metric name is required");
        }
        return metrics;
    }

    private static String required(String ruleId, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRuleDefinitionException(ruleId, field + " is required");
        }
        return value.trim();
    }
}
