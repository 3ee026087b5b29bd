package com.batchanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Final report of a job, surfaced to the scheduler loop for logging and metrics.
 */
@Value
@Builder
public class ExecutionResult {

    String jobId;
    String ruleId;
    String tableName;
    String metricName;
    String generatedSqlQuery;
    long recordCount;
    JobStatus status;
    int attemptCount;
    long durationMs;
    String errorMessage;

    public static ExecutionResult from(JobExecution job) {
        JobExecution snapshot = job.snapshot();
        return ExecutionResult.builder()
                .jobId(snapshot.getJobId())
                .ruleId(snapshot.getRuleId())
                .tableName(snapshot.getTableName())
                .metricName(snapshot.getMetricName())
                .generatedSqlQuery(snapshot.getGeneratedQuery())
                .recordCount(snapshot.getRecordCount())
                .status(snapshot.getStatus())
                .attemptCount(snapshot.getAttemptCount())
                .durationMs(snapshot.getDurationMs())
                .errorMessage(snapshot.getErrorMessage())
                .build();
    }
}
