package com.batchanalytics.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Parsed rule filter: conditions joined left to right by AND/OR.
 *
 * {@code connectors.get(i)} joins {@code conditions.get(i)} and {@code conditions.get(i + 1)}.
 */
@Value
public class FilterPredicate {

    List<Condition> conditions;
    List<Connector> connectors;

    public FilterPredicate(List<Condition> conditions, List<Connector> connectors) {
        if (conditions.isEmpty() || connectors.size() != conditions.size() - 1) {
            throw new IllegalArgumentException("A predicate needs n conditions and n-1 connectors");
        }
        this.conditions = List.copyOf(conditions);
        this.connectors = List.copyOf(connectors);
    }

    public enum Connector {
        AND, OR
    }

    public enum Operator {
        EQ("="),
        NE("<>"),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        LIKE("LIKE"),
        IN("IN");

        private final String sql;

        Operator(String sql) {
            this.sql = sql;
        }

        public String getSql() {
            return sql;
        }
    }

    /**
     * One {@code column OP value} comparison. IN carries several values, every other
     * operator exactly one.
     */
    @Value
    public static class Condition {
        String column;
        Operator operator;
        List<Object> values;

        public Condition(String column, Operator operator, List<Object> values) {
            if (operator != Operator.IN && values.size() != 1) {
                throw new IllegalArgumentException(operator + " takes exactly one value");
            }
            if (values.isEmpty()) {
                throw new IllegalArgumentException("IN needs at least one value");
            }
            this.column = column;
            this.operator = operator;
            this.values = List.copyOf(values);
        }
    }
}
