package com.batchanalytics.domain.service;

import com.batchanalytics.config.StoreProperties;
import com.batchanalytics.domain.model.AggregateRow;
import com.batchanalytics.domain.model.JobExecution;
import com.batchanalytics.domain.port.RuleStore;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes jobs and their outcomes to the rule store.
 *
 * Writes are retried; once retries are exhausted the failure is logged as
 * RESULT_WRITE_FAILED and counted. A lost outcome write is an operational problem, not
 * a job failure: the job keeps the status it earned. A job whose PENDING row cannot be
 * created never runs.
 */
@Slf4j
@Component
public class ResultRecorder {

    private final RuleStore ruleStore;
    private final MeterRegistry meterRegistry;
    private final Retry retry;

    public ResultRecorder(RuleStore ruleStore, StoreProperties properties, MeterRegistry meterRegistry) {
        this.ruleStore = ruleStore;
        this.meterRegistry = meterRegistry;
        this.retry = Retry.of("rule-store-write", RetryConfig.custom()
                .maxAttempts(properties.getWriteAttempts())
                .waitDuration(properties.getWriteRetryDelay())
                .retryExceptions(RuntimeException.class)
                .build());
    }

    public enum Creation {
        CREATED,
        /** Another tick or instance already created the job for this instant. */
        DUPLICATE,
        FAILED
    }

    /**
     * Insert the PENDING row for a new job.
     */
    public Creation createPending(JobExecution job) {
        JobExecution snapshot = job.snapshot();
        try {
            return retry.executeSupplier(() -> ruleStore.createPending(snapshot))
                    ? Creation.CREATED
                    : Creation.DUPLICATE;
        } catch (RuntimeException e) {
            writeFailed(snapshot.getJobId(), "create", e);
            return Creation.FAILED;
        }
    }

    /**
     * @return false if the write was given up
     */
    public boolean recordExecution(JobExecution job) {
        JobExecution snapshot = job.snapshot();
        return write(snapshot.getJobId(), "execution", () -> ruleStore.recordExecution(snapshot));
    }

    /**
     * @return false if the write was given up
     */
    public boolean recordResults(JobExecution job, List<AggregateRow> rows) {
        if (rows.isEmpty()) {
            log.warn("No aggregate rows for job {} - nothing to store", job.getJobId());
            return true;
        }
        JobExecution snapshot = job.snapshot();
        return write(snapshot.getJobId(), "results", () -> ruleStore.recordResults(snapshot, rows));
    }

    private boolean write(String jobId, String what, Runnable write) {
        try {
            retry.executeRunnable(write);
            return true;
        } catch (RuntimeException e) {
            writeFailed(jobId, what, e);
            return false;
        }
    }

    private void writeFailed(String jobId, String what, RuntimeException e) {
        log.error("RESULT_WRITE_FAILED job={} ({}): {}", jobId, what, e.getMessage(), e);
        Counter.builder("rule.store.write.failures")
                .tag("kind", what)
                .register(meterRegistry)
                .increment();
    }
}
