package com.batchanalytics.infrastructure.persistence.entity;

import com.batchanalytics.domain.model.JobStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One scheduled run of a rule.
 *
 * The primary key is the job id ({@code ruleId@scheduledMinute}); inserting it is what
 * stops two ticks or two instances from running the same instant twice. New rows are
 * always INSERTed, never merged, so a second insert of the same id fails on the key.
 */
@Entity
@Table(name = "job_executions", indexes = {
    @Index(name = "idx_job_rule_id", columnList = "rule_id"),
    @Index(name = "idx_job_status", columnList = "status"),
    @Index(name = "idx_job_scheduled_at", columnList = "scheduled_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionEntity implements Persistable<String> {

    @Id
    @Column(name = "job_id", length = 320)
    private String jobId;

    @Column(name = "rule_id", nullable = false, length = 255)
    private String ruleId;

    @Column(name = "table_name", length = 255)
    private String tableName;

    @Column(name = "metric_name", length = 1000)
    private String metricName;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "generated_sql_query", columnDefinition = "TEXT")
    private String generatedSqlQuery;

    @Column(name = "record_count", nullable = false)
    private long recordCount;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Transient
    private boolean newEntity;

    @Override
    public String getId() {
        return jobId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    protected void markNotNew() {
        newEntity = false;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || finishedAt == null) {
            return 0;
        }
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
