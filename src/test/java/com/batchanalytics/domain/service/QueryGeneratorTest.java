package com.batchanalytics.domain.service;

import com.batchanalytics.domain.exception.UnsupportedAggregationException;
import com.batchanalytics.domain.exception.UnsupportedGranularityException;
import com.batchanalytics.domain.model.AggregationFunction;
import com.batchanalytics.domain.model.FilterPredicate;
import com.batchanalytics.domain.model.GeneratedQuery;
import com.batchanalytics.domain.model.Granularity;
import com.batchanalytics.domain.model.QueryWindow;
import com.batchanalytics.domain.model.RuleCatalog;
import com.batchanalytics.domain.model.RuleDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryGenerator.
 *
 * The SQL text is asserted literally: downstream jobs and operators diff it between runs.
 */
class QueryGeneratorTest {

    private final FilterPredicateParser filterParser = new FilterPredicateParser();
    private RuleCatalog catalog;
    private QueryGenerator generator;

    @BeforeEach
    void setUp() {
        catalog = RuleCatalog.defaults();
        generator = new QueryGenerator(catalog, "timestamp");
    }

    @Test
    void testGenerate_HourlyAverage() {
        // Given
        RuleDefinition rule = rule("r1", "du_metrics", "cpu_usage", AggregationFunction.AVG, "1-hour").build();

        // When
        GeneratedQuery query = generator.generate(rule);

        // Then
        assertEquals("SELECT date_trunc('hour', \"timestamp\") AS time_bucket, "
                + "AVG(CAST(\"cpu_usage\" AS NUMERIC)) AS \"avg_hour_cpu_usage\" "
                + "FROM \"du_metrics\" "
                + "WHERE \"timestamp\" >= ? AND \"timestamp\" < ? "
                + "GROUP BY time_bucket ORDER BY time_bucket", query.getSql());
        assertTrue(query.getParameters().isEmpty());
        assertEquals(List.of("avg_hour_cpu_usage"), query.getMetricAliases());
    }

    @Test
    void testGenerate_Deterministic() {
        // Given
        RuleDefinition rule = rule("r1", "du_metrics", "cpu_usage", AggregationFunction.SUM, "6-hour")
                .filterPredicate(filterParser.parse("test", "region = 'east'"))
                .build();

        // When
        GeneratedQuery first = generator.generate(rule);
        GeneratedQuery second = generator.generate(rule);

        // Then
        assertEquals(first, second);
    }

    @Test
    void testGenerate_MultiHourBucketUsesEpochFloor() {
        // Given
        RuleDefinition rule = rule("r2", "du_metrics", "prb_util", AggregationFunction.MAX, "4-hour").build();

        // When
        GeneratedQuery query = generator.generate(rule);

        // Then
        assertTrue(query.getSql().startsWith(
                "SELECT to_timestamp(floor(extract(epoch from \"timestamp\") / 14400) * 14400) AS time_bucket, "
                        + "MAX(CAST(\"prb_util\" AS NUMERIC)) AS \"max_4_hour_prb_util\""));
    }

    @Test
    void testGenerate_DailyAndWeeklyBuckets() {
        // When
        GeneratedQuery daily = generator.generate(
                rule("r3", "cu_metrics", "drops", AggregationFunction.COUNT, "1-day").build());
        GeneratedQuery weekly = generator.generate(
                rule("r4", "cu_metrics", "drops", AggregationFunction.MEDIAN, "1-week").build());

        // Then
        assertTrue(daily.getSql().contains("date_trunc('day', \"timestamp\") AS time_bucket, "
                + "COUNT(\"drops\") AS \"count_day_drops\""));
        assertTrue(weekly.getSql().contains("date_trunc('week', \"timestamp\") AS time_bucket, "
                + "percentile_cont(0.5) WITHIN GROUP (ORDER BY CAST(\"drops\" AS NUMERIC)) AS \"median_week_drops\""));
    }

    @Test
    void testGenerate_FirstAndLastOrderByTimestamp() {
        // When
        GeneratedQuery last = generator.generate(
                rule("r5", "du_metrics", "state", AggregationFunction.LAST, "1-hour").build());

        // Then
        assertTrue(last.getSql().contains(
                "(array_agg(\"state\" ORDER BY \"timestamp\" DESC))[1] AS \"last_hour_state\""));
    }

    @Test
    void testGenerate_OneColumnPerMetric() {
        // Given
        RuleDefinition rule = RuleDefinition.builder()
                .ruleId("r6")
                .tableName("du_metrics")
                .metricName("cpu_usage")
                .metricName("mem_usage")
                .aggregation(AggregationFunction.AVG)
                .granularity(granularity("1-hour"))
                .scheduleName("EVERYHOUR")
                .build();

        // When
        GeneratedQuery query = generator.generate(rule);

        // Then
        assertEquals(List.of("avg_hour_cpu_usage", "avg_hour_mem_usage"), query.getMetricAliases());
        assertTrue(query.getSql().contains(
                "AVG(CAST(\"cpu_usage\" AS NUMERIC)) AS \"avg_hour_cpu_usage\", "
                        + "AVG(CAST(\"mem_usage\" AS NUMERIC)) AS \"avg_hour_mem_usage\" FROM"));
    }

    @Test
    void testGenerate_FilterValuesAreBindParameters() {
        // Given
        FilterPredicate filter = filterParser.parse("test", "region = 'east' AND site IN ('s1', 's2') OR load > 0.5");
        RuleDefinition rule = rule("r7", "du_metrics", "cpu_usage", AggregationFunction.AVG, "1-hour")
                .filterPredicate(filter)
                .build();

        // When
        GeneratedQuery query = generator.generate(rule);

        // Then
        assertTrue(query.getSql().contains("WHERE \"timestamp\" >= ? AND \"timestamp\" < ? "
                + "AND (\"region\" = ? AND \"site\" IN (?, ?) OR \"load\" > ?) GROUP BY"));
        assertEquals(4, query.getParameters().size());
        assertEquals("east", query.getParameters().get(0));
        assertEquals("s1", query.getParameters().get(1));
        assertEquals("s2", query.getParameters().get(2));
        assertFalse(query.getSql().contains("east"));
    }

    @Test
    void testGenerate_QuotesHostileIdentifiers() {
        // Given
        RuleDefinition rule = rule("r8", "du\"; DROP TABLE x; --", "cpu\"usage", AggregationFunction.SUM, "1-hour").build();

        // When
        GeneratedQuery query = generator.generate(rule);

        // Then
        assertTrue(query.getSql().contains("FROM \"du\"\"; DROP TABLE x; --\" WHERE"));
        assertTrue(query.getSql().contains("SUM(CAST(\"cpu\"\"usage\" AS NUMERIC))"));
    }

    @Test
    void testGenerate_SchemaQualifiedTable() {
        // When
        GeneratedQuery query = generator.generate(
                rule("r9", "kpi.du_metrics", "cpu_usage", AggregationFunction.AVG, "1-hour").build());

        // Then
        assertTrue(query.getSql().contains("FROM \"kpi\".\"du_metrics\" WHERE"));
    }

    @Test
    void testGenerate_CustomTimestampColumn() {
        // Given
        QueryGenerator custom = new QueryGenerator(catalog, "event_time");

        // When
        GeneratedQuery query = custom.generate(
                rule("r1", "du_metrics", "cpu_usage", AggregationFunction.AVG, "1-hour").build());

        // Then
        assertTrue(query.getSql().contains("WHERE \"event_time\" >= ? AND \"event_time\" < ?"));
    }

    @Test
    void testGenerate_UnsupportedAggregation() {
        // Given
        RuleCatalog sumOnly = new RuleCatalog(catalog.getSchedules(), Map.of("1-hour", 1),
                EnumSet.of(AggregationFunction.SUM));
        QueryGenerator restricted = new QueryGenerator(sumOnly, "timestamp");
        RuleDefinition rule = rule("r1", "du_metrics", "cpu_usage", AggregationFunction.AVG, "1-hour").build();

        // When / Then
        UnsupportedAggregationException e = assertThrows(UnsupportedAggregationException.class,
                () -> restricted.generate(rule));
        assertEquals("r1", e.getRuleId());
    }

    @Test
    void testGenerate_UnsupportedGranularity() {
        // Given
        RuleDefinition rule = RuleDefinition.builder()
                .ruleId("r1")
                .tableName("du_metrics")
                .metricName("cpu_usage")
                .aggregation(AggregationFunction.AVG)
                .granularity(new Granularity("5-hour", 5))
                .scheduleName("EVERYHOUR")
                .build();

        // When / Then
        assertThrows(UnsupportedGranularityException.class, () -> generator.generate(rule));
    }

    @Test
    void testBind_WindowBoundsFirst() {
        // Given
        FilterPredicate filter = filterParser.parse("test", "region = 'east'");
        GeneratedQuery query = generator.generate(
                rule("r1", "du_metrics", "cpu_usage", AggregationFunction.AVG, "1-hour").filterPredicate(filter).build());
        Instant scheduledAt = Instant.parse("2024-03-01T09:00:00Z");

        // When
        Object[] args = query.bind(QueryWindow.endingAt(scheduledAt, granularity("1-hour")));

        // Then
        assertEquals(3, args.length);
        assertEquals(Timestamp.from(Instant.parse("2024-03-01T08:00:00Z")), args[0]);
        assertEquals(Timestamp.from(scheduledAt), args[1]);
        assertEquals("east", args[2]);
    }

    private RuleDefinition.RuleDefinitionBuilder rule(String id, String table, String metric,
                                                      AggregationFunction aggregation, String granularity) {
        return RuleDefinition.builder()
                .ruleId(id)
                .tableName(table)
                .metricName(metric)
                .aggregation(aggregation)
                .granularity(granularity(granularity))
                .scheduleName("EVERYHOUR");
    }

    private Granularity granularity(String label) {
        return catalog.granularity(label).orElseThrow();
    }
}
