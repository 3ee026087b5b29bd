package com.batchanalytics.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Half-open time range [start, end) a job aggregates over.
 */
@Value
public class QueryWindow {

    Instant start;
    Instant end;

    /**
     * The last whole bucket before the one {@code scheduledAt} falls in. Only whole
     * buckets are queried.
     */
    public static QueryWindow endingAt(Instant scheduledAt, Granularity granularity) {
        Instant end = granularity.bucketStart(scheduledAt);
        return new QueryWindow(end.minus(granularity.toDuration()), end);
    }
}
