package com.batchanalytics.domain.port;

import com.batchanalytics.domain.exception.ResultWriteException;
import com.batchanalytics.domain.exception.StoreUnavailableException;
import com.batchanalytics.domain.model.AggregateRow;
import com.batchanalytics.domain.model.JobExecution;
import com.batchanalytics.domain.model.RuleDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent state of the scheduler: rule definitions in, job executions and
 * aggregated rows out. The only component that touches the store.
 */
public interface RuleStore {

    /**
     * Enabled, valid rules. Invalid rows are logged and left out.
     *
     * @throws StoreUnavailableException when the store cannot be read
     */
    List<RuleDefinition> loadRules();

    /**
     * Insert the job in PENDING state.
     *
     * @return false when a job with the same id already exists
     */
    boolean createPending(JobExecution job);

    /**
     * Atomically move a PENDING job to RUNNING.
     *
     * @return false if the job is missing, already running or terminal
     */
    boolean markClaimed(String jobId, Instant startedAt);

    /**
     * @throws ResultWriteException when the row cannot be written
     */
    void recordExecution(JobExecution job);

    /**
     * @throws ResultWriteException when the rows cannot be written
     */
    void recordResults(JobExecution job, List<AggregateRow> rows);

    Optional<JobExecution> findJob(String jobId);

    /**
     * Fail every non-terminal job last touched before {@code cutoff}.
     *
     * @return number of jobs failed
     */
    int failAbandoned(Instant cutoff, String reason);
}
