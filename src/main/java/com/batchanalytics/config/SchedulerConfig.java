package com.batchanalytics.config;

import com.batchanalytics.domain.model.AggregationFunction;
import com.batchanalytics.domain.model.RuleCatalog;
import com.batchanalytics.domain.model.ScheduleSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Configuration
@EnableConfigurationProperties({SchedulerProperties.class, StoreProperties.class, CatalogProperties.class})
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Catalog built once at startup; invalid cron, zone or aggregation entries fail the boot.
     */
    @Bean
    public RuleCatalog ruleCatalog(CatalogProperties properties) {
        RuleCatalog defaults = RuleCatalog.defaults();

        Map<String, ScheduleSpec> schedules = new LinkedHashMap<>();
        if (properties.getSchedules().isEmpty()) {
            schedules.putAll(defaults.getSchedules());
        } else {
            properties.getSchedules().forEach((name, schedule) ->
                    schedules.put(name, ScheduleSpec.of(schedule.getCron(), ZoneId.of(schedule.getZone()))));
        }

        Map<String, Integer> granularities = new LinkedHashMap<>(properties.getGranularities());
        if (granularities.isEmpty()) {
            defaults.getGranularities().values()
                    .forEach(g -> granularities.put(g.getLabel(), g.getHours()));
        }

        Set<AggregationFunction> aggregations = EnumSet.noneOf(AggregationFunction.class);
        if (properties.getAggregations().isEmpty()) {
            aggregations.addAll(defaults.getAggregations());
        } else {
            for (String code : properties.getAggregations()) {
                aggregations.add(AggregationFunction.fromCode(code)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown aggregation in app.catalog: " + code)));
            }
        }

        RuleCatalog catalog = new RuleCatalog(schedules, granularities, aggregations);
        log.info("Rule catalog: {} schedules, {} granularities, aggregations {}",
                catalog.getSchedules().size(), catalog.getGranularities().size(), catalog.getAggregations());
        return catalog;
    }
}
