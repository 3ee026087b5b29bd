package com.batchanalytics.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One attempt to run a rule for a specific scheduled instant.
 *
 * A worker thread and the timeout watchdog may act on the same instance, so every
 * state change goes through a synchronized transition. {@code tryX} methods return
 * false instead of throwing when the job has already moved on (typically: it timed out
 * while the worker was still busy).
 */
@Getter
public class JobExecution {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final String jobId;
    private final String ruleId;
    private final String tableName;
    private final String metricName;
    private final Instant scheduledAt;

    private JobStatus status;
    private int attemptCount;
    private String generatedQuery;
    private long recordCount;
    private String errorMessage;
    private Instant startedAt;
    private Instant finishedAt;

    @Builder(toBuilder = true)
    private JobExecution(String jobId, String ruleId, String tableName, String metricName, Instant scheduledAt,
                         JobStatus status, int attemptCount, String generatedQuery, long recordCount,
                         String errorMessage, Instant startedAt, Instant finishedAt) {
        this.jobId = jobId != null ? jobId : jobIdFor(ruleId, scheduledAt);
        this.ruleId = ruleId;
        this.tableName = tableName;
        this.metricName = metricName;
        this.scheduledAt = scheduledAt;
        this.status = status != null ? status : JobStatus.PENDING;
        this.attemptCount = attemptCount;
        this.generatedQuery = generatedQuery;
        this.recordCount = recordCount;
        this.errorMessage = errorMessage;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    /**
     * Fresh PENDING job for a rule due at {@code scheduledAt}.
     */
    public static JobExecution pending(RuleDefinition rule, Instant scheduledAt) {
        return JobExecution.builder()
                .ruleId(rule.getRuleId())
                .tableName(rule.getTableName())
                .metricName(rule.metricNameLabel())
                .scheduledAt(scheduledAt)
                .build();
    }

    /**
     * Job ids are keyed by rule and scheduled minute, so two ticks that see the same
     * due instant produce the same id.
     */
    public static String jobIdFor(String ruleId, Instant scheduledAt) {
        return ruleId + "@" + scheduledAt.truncatedTo(ChronoUnit.MINUTES);
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized long getRecordCount() {
        return recordCount;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized String getGeneratedQuery() {
        return generatedQuery;
    }

    public synchronized void markStarted(Instant now) {
        transition(JobStatus.RUNNING);
        this.startedAt = now;
    }

    public synchronized void attachQuery(String sql) {
        this.generatedQuery = sql;
    }

    /**
     * RETRYING -> RUNNING (or the first RUNNING) and count the attempt. Returns false
     * if the job is already terminal.
     */
    public synchronized boolean tryBeginAttempt() {
        if (status == JobStatus.RETRYING && !tryTransition(JobStatus.RUNNING)) {
            return false;
        }
        if (status != JobStatus.RUNNING) {
            return false;
        }
        attemptCount++;
        return true;
    }

    public synchronized boolean tryMarkSucceeded(long records, Instant now) {
        if (!tryTransition(JobStatus.SUCCEEDED)) {
            return false;
        }
        this.recordCount = records;
        this.errorMessage = null;
        this.finishedAt = now;
        return true;
    }

    public synchronized boolean tryMarkRetrying(String error) {
        if (!tryTransition(JobStatus.RETRYING)) {
            return false;
        }
        this.errorMessage = truncate(error);
        return true;
    }

    public synchronized boolean tryMarkFailed(String error, Instant now) {
        if (!tryTransition(JobStatus.FAILED)) {
            return false;
        }
        this.errorMessage = truncate(error);
        this.finishedAt = now;
        return true;
    }

    public synchronized boolean tryMarkTimedOut(String error, Instant now) {
        if (!tryTransition(JobStatus.TIMED_OUT)) {
            return false;
        }
        this.errorMessage = truncate(error);
        this.finishedAt = now;
        return true;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized long getDurationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0;
        }
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    /**
     * Consistent copy, safe to hand to the store while the worker keeps going.
     */
    public synchronized JobExecution snapshot() {
        return toBuilder().build();
    }

    private void transition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    private boolean tryTransition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        this.status = next;
        return true;
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    @Override
    public synchronized String toString() {
        return "JobExecution[" + jobId + ", " + status + ", attempts=" + attemptCount + "]";
    }
}
