package com.batchanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregated value written back by a job, one row per time bucket and metric.
 *
 * Downstream threshold and reporting jobs read this table.
 */
@Entity
@Table(name = "rule_execution_results", indexes = {
    @Index(name = "idx_result_metric_bucket", columnList = "aggregated_metric_name,time_bucket"),
    @Index(name = "idx_result_job_id", columnList = "job_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 320)
    private String jobId;

    @Column(name = "rule_id", nullable = false, length = 255)
    private String ruleId;

    @Column(name = "time_bucket")
    private Instant timeBucket;

    @Column(name = "aggregated_metric_name", nullable = false, length = 1000)
    private String aggregatedMetricName;

    @Column(name = "aggregated_value", precision = 38, scale = 10)
    private BigDecimal aggregatedValue;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
