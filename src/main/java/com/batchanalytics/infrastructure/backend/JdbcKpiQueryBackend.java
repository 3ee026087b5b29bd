package com.batchanalytics.infrastructure.backend;

import com.batchanalytics.domain.model.AggregateRow;
import com.batchanalytics.domain.model.GeneratedQuery;
import com.batchanalytics.domain.model.QueryWindow;
import com.batchanalytics.domain.port.KpiQueryBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs generated aggregation queries over the shared Hikari pool.
 *
 * Each statement gets a query timeout equal to what is left of the job's budget, so a
 * hung query is cancelled by the driver rather than holding a pooled connection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcKpiQueryBackend implements KpiQueryBackend {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<AggregateRow> execute(GeneratedQuery query, QueryWindow window, Duration timeout) {
        Object[] args = query.bind(window);
        int timeoutSeconds = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toSeconds()));

        PreparedStatementCreator statement = connection -> {
            PreparedStatement ps = connection.prepareStatement(query.getSql());
            ps.setQueryTimeout(timeoutSeconds);
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            return ps;
        };

        List<AggregateRow> rows = new ArrayList<>();
        long start = System.currentTimeMillis();
        jdbcTemplate.query(statement, (RowCallbackHandler) rs -> mapRow(rs, query.getMetricAliases(), rows));
        log.debug("Query over [{}, {}) returned {} rows in {} ms",
                window.getStart(), window.getEnd(), rows.size(), System.currentTimeMillis() - start);
        return rows;
    }

    /**
     * One result row carries the bucket plus one column per metric alias.
     */
    static void mapRow(ResultSet rs, List<String> aliases, List<AggregateRow> out) throws SQLException {
        Timestamp bucket = rs.getTimestamp("time_bucket");
        for (String alias : aliases) {
            out.add(AggregateRow.builder()
                    .timeBucket(bucket != null ? bucket.toInstant() : null)
                    .aggregatedMetricName(alias)
                    .value(toBigDecimal(rs.getObject(alias)))
                    .build());
        }
    }

    static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Non-numeric aggregate value '{}', storing null", value);
            return null;
        }
    }
}
