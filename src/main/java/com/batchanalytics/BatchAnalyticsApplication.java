package com.batchanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Batch Analytics Scheduler
 *
 * Periodically evaluates persisted KPI rules, turns the due ones into aggregation
 * queries and runs them with bounded concurrency.
 *
 * Architecture:
 * - Scheduler loop ticking on a fixed interval
 * - Cron-based trigger engine with per-rule idempotence
 * - Worker pool with retry, backoff and per-job timeout
 * - PostgreSQL rule store with unique job ids as the claim primitive
 * - Redis for fired-instant memory across restarts
 * - REST API for operators
 */
@SpringBootApplication
@EnableScheduling
public class BatchAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchAnalyticsApplication.class, args);
    }
}
