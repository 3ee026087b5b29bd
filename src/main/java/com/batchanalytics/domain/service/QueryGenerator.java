package com.batchanalytics.domain.service;

import com.batchanalytics.domain.exception.UnsupportedAggregationException;
import com.batchanalytics.domain.exception.UnsupportedGranularityException;
import com.batchanalytics.domain.model.AggregationFunction;
import com.batchanalytics.domain.model.FilterPredicate;
import com.batchanalytics.domain.model.GeneratedQuery;
import com.batchanalytics.domain.model.Granularity;
import com.batchanalytics.domain.model.RuleCatalog;
import com.batchanalytics.domain.model.RuleDefinition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the time-bucketed aggregation query for a rule.
 *
 * Output shape (PostgreSQL):
 * <pre>
 * SELECT &lt;bucket&gt; AS time_bucket, &lt;agg&gt;(&lt;metric&gt;) AS "&lt;alias&gt;"
 * FROM "&lt;table&gt;"
 * WHERE "timestamp" &gt;= ? AND "timestamp" &lt; ? [AND (&lt;filter&gt;)]
 * GROUP BY time_bucket ORDER BY time_bucket
 * </pre>
 *
 * Only catalog tokens are written into the SQL as-is. Table, metric and filter column
 * names are quoted identifiers; filter values are always bind parameters. Same rule
 * in, same text out.
 */
@Component
public class QueryGenerator {

    private static final String BUCKET_ALIAS = "time_bucket";

    private final RuleCatalog catalog;
    private final String timestampColumn;

    public QueryGenerator(RuleCatalog catalog,
                          @Value("${app.query.timestamp-column:timestamp}") String timestampColumn) {
        this.catalog = catalog;
        this.timestampColumn = timestampColumn;
    }

    public GeneratedQuery generate(RuleDefinition rule) {
        AggregationFunction aggregation = rule.getAggregation();
        if (!catalog.supports(aggregation)) {
            throw new UnsupportedAggregationException(rule.getRuleId(), aggregation.getCode());
        }
        Granularity granularity = rule.getGranularity();
        if (!catalog.supports(granularity)) {
            throw new UnsupportedGranularityException(rule.getRuleId(), granularity.getLabel());
        }

        String timestamp = quoteIdentifier(timestampColumn);
        List<String> aliases = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(bucketExpression(granularity, timestamp))
                .append(" AS ").append(BUCKET_ALIAS);

        for (String metric : rule.getMetricNames()) {
            String alias = aggregatedMetricName(aggregation, granularity, metric);
            aliases.add(alias);
            sql.append(", ")
                    .append(aggregation.render(quoteIdentifier(metric), timestamp))
                    .append(" AS ").append(quoteIdentifier(alias));
        }

        sql.append(" FROM ").append(quoteQualifiedName(rule.getTableName()))
                .append(" WHERE ").append(timestamp).append(" >= ? AND ")
                .append(timestamp).append(" < ?");

        List<Object> parameters = new ArrayList<>();
        FilterPredicate filter = rule.getFilterPredicate();
        if (filter != null) {
            sql.append(" AND (").append(renderFilter(filter, parameters)).append(")");
        }

        sql.append(" GROUP BY ").append(BUCKET_ALIAS)
                .append(" ORDER BY ").append(BUCKET_ALIAS);

        return new GeneratedQuery(sql.toString(), parameters, aliases);
    }

    /**
     * Name under which an aggregate is stored, e.g. {@code avg_hour_cpu_usage}.
     */
    public static String aggregatedMetricName(AggregationFunction aggregation, Granularity granularity, String metric) {
        return aggregation.getCode() + "_" + granularity.unitName() + "_" + metric;
    }

    /**
     * Double-quote an identifier, doubling any embedded quote.
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty() || identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quote each part of a schema-qualified name ({@code kpi.du_metrics}).
     */
    static String quoteQualifiedName(String name) {
        String[] parts = name.split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Invalid table name: " + name);
        }
        StringBuilder quoted = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                quoted.append('.');
            }
            quoted.append(quoteIdentifier(parts[i]));
        }
        return quoted.toString();
    }

    private static String bucketExpression(Granularity granularity, String timestamp) {
        return switch (granularity.getHours()) {
            case 1 -> "date_trunc('hour', " + timestamp + ")";
            case 24 -> "date_trunc('day', " + timestamp + ")";
            case 168 -> "date_trunc('week', " + timestamp + ")";
            default -> {
                long seconds = granularity.getHours() * 3600L;
                yield "to_timestamp(floor(extract(epoch from " + timestamp + ") / " + seconds + ") * " + seconds + ")";
            }
        };
    }

    private static String renderFilter(FilterPredicate filter, List<Object> parameters) {
        StringBuilder sql = new StringBuilder();
        List<FilterPredicate.Condition> conditions = filter.getConditions();
        for (int i = 0; i < conditions.size(); i++) {
            if (i > 0) {
                sql.append(' ').append(filter.getConnectors().get(i - 1).name()).append(' ');
            }
            FilterPredicate.Condition condition = conditions.get(i);
            sql.append(quoteIdentifier(condition.getColumn()))
                    .append(' ').append(condition.getOperator().getSql()).append(' ');
            if (condition.getOperator() == FilterPredicate.Operator.IN) {
                sql.append('(');
                for (int v = 0; v < condition.getValues().size(); v++) {
                    sql.append(v == 0 ? "?" : ", ?");
                }
                sql.append(')');
            } else {
                sql.append('?');
            }
            parameters.addAll(condition.getValues());
        }
        return sql.toString();
    }
}
