package com.batchanalytics.domain.model;

import lombok.Value;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;

/**
 * Recurrence of a named schedule: a five-field cron (minute hour day-of-month month
 * day-of-week) evaluated in a time zone.
 */
@Value
public class ScheduleSpec {

    String cron;
    ZoneId zone;
    CronExpression expression;

    public static ScheduleSpec of(String cron, ZoneId zone) {
        String trimmed = cron == null ? "" : cron.trim();
        if (trimmed.split("\\s+").length != 5) {
            throw new IllegalArgumentException("Expected five cron fields but got: '" + cron + "'");
        }
        // Spring's parser wants a leading seconds field
        return new ScheduleSpec(trimmed, zone, CronExpression.parse("0 " + trimmed));
    }
}
