package com.batchanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Rule definition as written by the CSV/JSON loaders.
 *
 * Values are kept as raw text; they are validated against the catalog each time
 * rules are loaded, so a bad row only ever disables itself.
 */
@Entity
@Table(name = "rule_definitions", indexes = {
    @Index(name = "idx_rule_enabled", columnList = "enabled")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleDefinitionEntity {

    @Id
    @Column(name = "rule_id", length = 255)
    private String ruleId;

    @Column(name = "table_name", nullable = false, length = 255)
    private String tableName;

    /** One metric or a comma-separated list. */
    @Column(name = "metric_name", nullable = false, length = 1000)
    private String metricName;

    @Column(nullable = false, length = 20)
    private String aggregation;

    @Column(nullable = false, length = 20)
    private String granularity;

    @Column(name = "schedule_name", nullable = false, length = 100)
    private String scheduleName;

    @Column(name = "filter_predicate", columnDefinition = "TEXT")
    private String filterPredicate;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
