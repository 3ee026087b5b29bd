package com.batchanalytics.domain.port;

import com.batchanalytics.domain.model.AggregateRow;
import com.batchanalytics.domain.model.GeneratedQuery;
import com.batchanalytics.domain.model.QueryWindow;

import java.time.Duration;
import java.util.List;

/**
 * Executes generated aggregation queries against the KPI tables.
 *
 * Implementations throw an unchecked exception on any backend failure; the engine
 * treats those as transient.
 */
public interface KpiQueryBackend {

    List<AggregateRow> execute(GeneratedQuery query, QueryWindow window, Duration timeout);
}
