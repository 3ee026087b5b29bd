package com.batchanalytics.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Aggregation functions a rule may apply over its metric column.
 *
 * Each constant renders its own SQL (PostgreSQL) given an already quoted
 * metric column and timestamp column.
 */
public enum AggregationFunction {

    SUM("sum"),
    AVG("avg"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    MEDIAN("median"),
    STD("std"),
    VAR("var"),
    FIRST("first"),
    LAST("last");

    private final String code;

    AggregationFunction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a rule's aggregation code ("avg", "AVG", " Avg ").
     */
    public static Optional<AggregationFunction> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AggregationFunction function : values()) {
            if (function.code.equals(normalized)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    /**
     * Render the aggregate expression.
     *
     * @param metric quoted metric column
     * @param timestamp quoted timestamp column, used to order first/last
     */
    public String render(String metric, String timestamp) {
        String numeric = "CAST(" + metric + " AS NUMERIC)";
        return switch (this) {
            case SUM -> "SUM(" + numeric + ")";
            case AVG -> "AVG(" + numeric + ")";
            case COUNT -> "COUNT(" + metric + ")";
            case MIN -> "MIN(" + numeric + ")";
            case MAX -> "MAX(" + numeric + ")";
            case MEDIAN -> "percentile_cont(0.5) WITHIN GROUP (ORDER BY " + numeric + ")";
            case STD -> "STDDEV_SAMP(" + numeric + ")";
            case VAR -> "VAR_SAMP(" + numeric + ")";
            case FIRST -> "(array_agg(" + metric + " ORDER BY " + timestamp + " ASC))[1]";
            case LAST -> "(array_agg(" + metric + " ORDER BY " + timestamp + " DESC))[1]";
        };
    }
}
