package com.batchanalytics.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a scheduled job.
 *
 * PENDING -> RUNNING | FAILED
 * RUNNING -> SUCCEEDED | RETRYING | FAILED | TIMED_OUT
 * RETRYING -> RUNNING | FAILED | TIMED_OUT
 *
 * PENDING -> FAILED and RETRYING -> FAILED only happen on cancellation.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    RETRYING,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, FAILED);
            case RUNNING -> EnumSet.of(SUCCEEDED, RETRYING, FAILED, TIMED_OUT);
            case RETRYING -> EnumSet.of(RUNNING, FAILED, TIMED_OUT);
            case SUCCEEDED, FAILED, TIMED_OUT -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
