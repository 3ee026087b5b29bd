package com.batchanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One bucketed value returned by an aggregation query.
 */
@Value
@Builder
public class AggregateRow {

    Instant timeBucket;
    String aggregatedMetricName;
    BigDecimal value;
}
