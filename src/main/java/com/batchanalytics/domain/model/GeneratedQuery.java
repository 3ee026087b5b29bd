package com.batchanalytics.domain.model;

import lombok.Value;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregation SQL produced for a rule.
 *
 * The statement starts with two placeholders for the window bounds
 * ({@code "timestamp" >= ? AND "timestamp" < ?}); {@link #parameters} holds the filter
 * values that follow them, in order.
 */
@Value
public class GeneratedQuery {

    String sql;
    List<Object> parameters;
    List<String> metricAliases;

    public GeneratedQuery(String sql, List<Object> parameters, List<String> metricAliases) {
        this.sql = sql;
        this.parameters = List.copyOf(parameters);
        this.metricAliases = List.copyOf(metricAliases);
    }

    /**
     * All bind values for one execution window.
     */
    public Object[] bind(QueryWindow window) {
        List<Object> args = new ArrayList<>(parameters.size() + 2);
        args.add(Timestamp.from(window.getStart()));
        args.add(Timestamp.from(window.getEnd()));
        args.addAll(parameters);
        return args.toArray();
    }
}
