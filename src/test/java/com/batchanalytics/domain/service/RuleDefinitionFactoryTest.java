package com.batchanalytics.domain.service;

import com.batchanalytics.domain.exception.InvalidFilterPredicateException;
import com.batchanalytics.domain.exception.InvalidRuleDefinitionException;
import com.batchanalytics.domain.exception.UnknownScheduleException;
import com.batchanalytics.domain.exception.UnsupportedAggregationException;
import com.batchanalytics.domain.exception.UnsupportedGranularityException;
import com.batchanalytics.domain.model.AggregationFunction;
import com.batchanalytics.domain.model.RuleCatalog;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.model.RuleRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleDefinitionFactoryTest {

    private final RuleDefinitionFactory factory =
            new RuleDefinitionFactory(RuleCatalog.defaults(), new FilterPredicateParser());

    @Test
    void testCreate_ValidRule() {
        // Given
        RuleRecord record = record().filterPredicate("region = 'east'").build();

        // When
        RuleDefinition rule = factory.create(record);

        // Then
        assertEquals("r1", rule.getRuleId());
        assertEquals("du_metrics", rule.getTableName());
        assertEquals(List.of("cpu_usage"), rule.getMetricNames());
        assertEquals(AggregationFunction.AVG, rule.getAggregation());
        assertEquals(1, rule.getGranularity().getHours());
        assertEquals("EVERYHOUR", rule.getScheduleName());
        assertNotNull(rule.getFilterPredicate());
        assertEquals("region = 'east'", rule.getFilterText());
    }

    @Test
    void testCreate_AggregationIsCaseInsensitive() {
        RuleDefinition rule = factory.create(record().aggregation(" Max ").build());

        assertEquals(AggregationFunction.MAX, rule.getAggregation());
    }

    @Test
    void testNormalizeMetricNames() {
        assertEquals(List.of("cpu_usage", "mem_used_pct"),
                RuleDefinitionFactory.normalizeMetricNames("r1", " CPU.Usage , mem.used.pct,cpu_usage,"));
    }

    @Test
    void testCreate_Rejections() {
        assertThrows(UnsupportedAggregationException.class,
                () -> factory.create(record().aggregation("p99").build()));
        assertThrows(UnsupportedGranularityException.class,
                () -> factory.create(record().granularity("5-hour").build()));
        assertThrows(UnknownScheduleException.class,
                () -> factory.create(record().scheduleName("EVERYFORTNIGHT").build()));
        assertThrows(InvalidFilterPredicateException.class,
                () -> factory.create(record().filterPredicate("region == 'east'").build()));
        assertThrows(InvalidRuleDefinitionException.class,
                () -> factory.create(record().tableName(" ").build()));
        assertThrows(InvalidRuleDefinitionException.class,
                () -> factory.create(record().metricName(" , ").build()));
        assertThrows(InvalidRuleDefinitionException.class,
                () -> factory.create(record().ruleId(null).build()));
    }

    private RuleRecord.RuleRecordBuilder record() {
        return RuleRecord.builder()
                .ruleId("r1")
                .tableName("du_metrics")
                .metricName("cpu_usage")
                .aggregation("avg")
                .granularity("1-hour")
                .scheduleName("EVERYHOUR");
    }
}
