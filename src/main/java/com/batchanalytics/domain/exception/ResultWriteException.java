package com.batchanalytics.domain.exception;

import lombok.Getter;

/**
 * A job outcome could not be persisted. Operational error, distinct from the job's
 * own failure.
 */
@Getter
public class ResultWriteException extends RuntimeException {

    private final String jobId;

    public ResultWriteException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }
}
