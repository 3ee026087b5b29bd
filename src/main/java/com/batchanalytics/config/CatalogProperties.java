package com.batchanalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables ({@code app.catalog.*}). Any table left empty falls back to the
 * built-in defaults.
 *
 * <pre>
 * app:
 *   catalog:
 *     schedules:
 *       EVERYDAY8AMET: { cron: "0 8 * * *", zone: America/New_York }
 *     granularities:
 *       1-hour: 1
 *     aggregations: [sum, avg]
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "app.catalog")
public class CatalogProperties {

    private Map<String, Schedule> schedules = new LinkedHashMap<>();

    private Map<String, Integer> granularities = new LinkedHashMap<>();

    private List<String> aggregations = new ArrayList<>();

    @Data
    public static class Schedule {
        private String cron;
        private String zone = "UTC";
    }
}
