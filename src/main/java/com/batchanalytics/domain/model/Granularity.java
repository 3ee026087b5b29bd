package com.batchanalytics.domain.model;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Time-bucket width of an aggregation, e.g. "1-hour" (1) or "1-week" (168).
 */
@Value
public class Granularity {

    String label;
    int hours;

    public Duration toDuration() {
        return Duration.ofHours(hours);
    }

    /**
     * Start of the bucket containing {@code instant}, truncated in UTC the same way the
     * generated query buckets rows: hour, day, ISO week (Monday) or a whole multiple of
     * the width since the epoch.
     */
    public Instant bucketStart(Instant instant) {
        return switch (hours) {
            case 1 -> instant.truncatedTo(ChronoUnit.HOURS);
            case 24 -> instant.truncatedTo(ChronoUnit.DAYS);
            case 168 -> instant.atOffset(ZoneOffset.UTC)
                    .toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .atStartOfDay(ZoneOffset.UTC)
                    .toInstant();
            default -> {
                long seconds = toDuration().getSeconds();
                yield Instant.ofEpochSecond(Math.floorDiv(instant.getEpochSecond(), seconds) * seconds);
            }
        };
    }

    /**
     * Short unit name used in aggregated metric names: hour, day, week or the label itself.
     */
    public String unitName() {
        return switch (hours) {
            case 1 -> "hour";
            case 24 -> "day";
            case 168 -> "week";
            default -> label.replace('-', '_');
        };
    }
}
