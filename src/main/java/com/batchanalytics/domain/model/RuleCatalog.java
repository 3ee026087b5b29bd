package com.batchanalytics.domain.model;

import lombok.Getter;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup tables shared by the loader, trigger engine and query generator:
 * schedule name to recurrence, granularity label to hours, and the supported
 * aggregation set.
 *
 * Built once from configuration and passed to each component at construction time.
 */
@Getter
public final class RuleCatalog {

    private final Map<String, ScheduleSpec> schedules;
    private final Map<String, Granularity> granularities;
    private final Set<AggregationFunction> aggregations;

    public RuleCatalog(Map<String, ScheduleSpec> schedules,
                       Map<String, Integer> granularityHours,
                       Set<AggregationFunction> aggregations) {
        this.schedules = Collections.unmodifiableMap(new LinkedHashMap<>(schedules));
        Map<String, Granularity> byLabel = new LinkedHashMap<>();
        granularityHours.forEach((label, hours) -> {
            if (hours == null || hours <= 0) {
                throw new IllegalArgumentException("Granularity " + label + " must be a positive hour count");
            }
            byLabel.put(label, new Granularity(label, hours));
        });
        this.granularities = Collections.unmodifiableMap(byLabel);
        this.aggregations = aggregations.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(aggregations));
    }

    public Optional<ScheduleSpec> schedule(String name) {
        return Optional.ofNullable(name).map(schedules::get);
    }

    public Optional<Granularity> granularity(String label) {
        return Optional.ofNullable(label).map(l -> granularities.get(l.trim()));
    }

    public boolean supports(AggregationFunction aggregation) {
        return aggregations.contains(aggregation);
    }

    public boolean supports(Granularity granularity) {
        return granularity != null && granularity.equals(granularities.get(granularity.getLabel()));
    }

    /**
     * Tables the batch jobs have always run with.
     */
    public static RuleCatalog defaults() {
        Map<String, ScheduleSpec> schedules = new LinkedHashMap<>();
        schedules.put("EVERYDAY8AMET", ScheduleSpec.of("0 8 * * *", ZoneId.of("America/New_York")));
        schedules.put("EVERYHOUR", ScheduleSpec.of("0 * * * *", ZoneOffset.UTC));
        schedules.put("EVERYWEEK", ScheduleSpec.of("0 0 * * 0", ZoneOffset.UTC));
        schedules.put("EVERYHOURBYMIN10", ScheduleSpec.of("10 * * * *", ZoneOffset.UTC));
        schedules.put("EVERYDAY", ScheduleSpec.of("0 0 * * *", ZoneOffset.UTC));
        schedules.put("EVERYMINUTE", ScheduleSpec.of("* * * * *", ZoneOffset.UTC));
        schedules.put("EVERY5MINUTES", ScheduleSpec.of("*/5 * * * *", ZoneOffset.UTC));
        schedules.put("EVERY15MINUTES", ScheduleSpec.of("*/15 * * * *", ZoneOffset.UTC));
        schedules.put("EVERY30MINUTES", ScheduleSpec.of("*/30 * * * *", ZoneOffset.UTC));

        Map<String, Integer> granularities = new LinkedHashMap<>();
        granularities.put("1-hour", 1);
        granularities.put("2-hour", 2);
        granularities.put("4-hour", 4);
        granularities.put("6-hour", 6);
        granularities.put("12-hour", 12);
        granularities.put("1-day", 24);
        granularities.put("2-day", 48);
        granularities.put("3-day", 72);
        granularities.put("1-week", 168);
        granularities.put("2-week", 336);

        return new RuleCatalog(schedules, granularities, EnumSet.allOf(AggregationFunction.class));
    }
}
