package com.batchanalytics.domain.service;

import com.batchanalytics.config.SchedulerProperties;
import com.batchanalytics.domain.exception.RuleDefinitionException;
import com.batchanalytics.domain.model.AggregateRow;
import com.batchanalytics.domain.model.GeneratedQuery;
import com.batchanalytics.domain.model.JobExecution;
import com.batchanalytics.domain.model.QueryWindow;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.port.KpiQueryBackend;
import com.batchanalytics.domain.port.RuleStore;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs due rules on a fixed pool of {@code maxConcurrentJobs} workers.
 *
 * Per job:
 * 1. Insert PENDING (submission, on the caller's thread); a job that cannot be
 *    inserted ends FAILED without running
 * 2. Claim PENDING -> RUNNING once a worker picks it up
 * 3. Generate the query and run it, retrying backend failures with backoff
 *    until {@code maxRetries} attempts are used
 * 4. Record the terminal state
 *
 * A watchdog moves a job to TIMED_OUT {@code jobTimeout} after its claim and interrupts
 * the worker. Timed out jobs are not retried. Every submitted job completes its future
 * normally, whatever happens to it.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private final QueryGenerator queryGenerator;
    private final KpiQueryBackend backend;
    private final RuleStore ruleStore;
    private final ResultRecorder recorder;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final ThreadPoolTaskExecutor workers;
    private final ThreadPoolTaskScheduler watchdog;
    private final IntervalFunction backoff;
    private final Map<String, InFlightJob> inFlight = new ConcurrentHashMap<>();

    public ExecutionEngine(QueryGenerator queryGenerator,
                           KpiQueryBackend backend,
                           RuleStore ruleStore,
                           ResultRecorder recorder,
                           SchedulerProperties properties,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.queryGenerator = queryGenerator;
        this.backend = backend;
        this.ruleStore = ruleStore;
        this.recorder = recorder;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        // owned here rather than as beans: shutdown() drives them once the ticker has stopped
        this.workers = new ThreadPoolTaskExecutor();
        this.workers.setCorePoolSize(properties.getMaxConcurrentJobs());
        this.workers.setMaxPoolSize(properties.getMaxConcurrentJobs());
        this.workers.setThreadNamePrefix("rule-worker-");
        this.workers.initialize();

        this.watchdog = new ThreadPoolTaskScheduler();
        this.watchdog.setPoolSize(1);
        this.watchdog.setRemoveOnCancelPolicy(true);
        this.watchdog.setThreadNamePrefix("rule-watchdog-");
        this.watchdog.initialize();

        this.backoff = properties.getRetryBackoffMultiplier() > 1.0
                ? IntervalFunction.ofExponentialBackoff(properties.getRetryDelay(), properties.getRetryBackoffMultiplier())
                : IntervalFunction.of(properties.getRetryDelay());
    }

    /**
     * Run the rules due at {@code scheduledAt} and wait for all of them.
     */
    public List<JobExecution> execute(List<RuleDefinition> rules, Instant scheduledAt) {
        List<JobExecution> results = new ArrayList<>();
        for (CompletableFuture<JobExecution> future : submit(rules, scheduledAt)) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Queue the rules due at {@code scheduledAt} without waiting for them.
     */
    public List<CompletableFuture<JobExecution>> submit(List<RuleDefinition> rules, Instant scheduledAt) {
        return submit(rules, scheduledAt, rule -> { });
    }

    /**
     * Queue the rules due at {@code scheduledAt} without waiting for them.
     *
     * Every rule gets a future. A rule whose job already exists for that instant is not
     * run again; its future carries the stored job. A rule whose job cannot be written
     * ends FAILED at once. {@code onRegistered} is told about every rule whose job is in
     * the store, so a rule left out of it can be tried again for the same instant.
     */
    public List<CompletableFuture<JobExecution>> submit(List<RuleDefinition> rules,
                                                        Instant scheduledAt,
                                                        Consumer<RuleDefinition> onRegistered) {
        List<CompletableFuture<JobExecution>> futures = new ArrayList<>();
        int queued = 0;
        for (RuleDefinition rule : rules) {
            JobExecution job = JobExecution.pending(rule, scheduledAt);
            ResultRecorder.Creation creation = recorder.createPending(job);
            if (creation == ResultRecorder.Creation.FAILED) {
                futures.add(CompletableFuture.completedFuture(notCreated(job)));
                continue;
            }
            onRegistered.accept(rule);
            if (creation == ResultRecorder.Creation.DUPLICATE) {
                log.debug("Job {} already exists, handled elsewhere", job.getJobId());
                Counter.builder("rule.jobs.duplicate")
                        .register(meterRegistry)
                        .increment();
                futures.add(CompletableFuture.completedFuture(readBack(job)));
                continue;
            }

            InFlightJob flight = new InFlightJob(job);
            inFlight.put(job.getJobId(), flight);
            FutureTask<Void> task = new FutureTask<>(() -> runJob(rule, flight), null);
            flight.worker = task;
            try {
                workers.execute(task);
                queued++;
            } catch (RejectedExecutionException e) {
                log.warn("Job {} rejected, engine is shutting down", job.getJobId());
                job.tryMarkFailed("Rejected: scheduler shutting down", clock.instant());
                complete(flight);
            }
            futures.add(flight.result);
        }
        log.debug("Queued {} of {} due rules for {}", queued, rules.size(), scheduledAt);
        return futures;
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    /**
     * Stop accepting work, give running jobs {@code gracePeriod} to finish, then cancel
     * the rest. Cancelled jobs end FAILED, so nothing stays RUNNING.
     */
    public void shutdown(Duration gracePeriod) {
        log.info("Shutting down execution engine, {} jobs in flight", inFlight.size());
        ThreadPoolExecutor pool = workers.getThreadPoolExecutor();
        pool.shutdown();
        try {
            if (!pool.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Grace period of {} elapsed, cancelling {} jobs", gracePeriod, inFlight.size());
                pool.shutdownNow();
                cancelInFlight("Cancelled during shutdown");
                if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.error("Workers did not terminate after cancellation");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            cancelInFlight("Cancelled during shutdown");
        } finally {
            watchdog.shutdown();
        }
    }

    /**
     * A job whose PENDING row could not be written. It never reached the store, so it is
     * only counted and returned.
     */
    private JobExecution notCreated(JobExecution job) {
        job.tryMarkFailed("Rule store unavailable: job could not be created", clock.instant());
        Counter.builder("rule.jobs.executed")
                .tag("status", job.getStatus().name())
                .register(meterRegistry)
                .increment();
        return job.snapshot();
    }

    private JobExecution readBack(JobExecution job) {
        try {
            return ruleStore.findJob(job.getJobId()).orElse(job.snapshot());
        } catch (RuntimeException e) {
            log.warn("Could not read back job {}: {}", job.getJobId(), e.getMessage());
            return job.snapshot();
        }
    }

    private void runJob(RuleDefinition rule, InFlightJob flight) {
        JobExecution job = flight.job;
        ScheduledFuture<?> timeout = null;
        try {
            Instant now = clock.instant();
            if (!ruleStore.markClaimed(job.getJobId(), now)) {
                log.info("Job {} already claimed elsewhere", job.getJobId());
                flight.claimLost = true;
                return;
            }
            job.markStarted(now);
            timeout = watchdog.schedule(() -> onTimeout(flight),
                    watchdog.getClock().instant().plus(properties.getJobTimeout()));
            runAttempts(rule, job);
        } catch (RuntimeException e) {
            log.error("Job {} aborted: {}", job.getJobId(), e.getMessage(), e);
            job.tryMarkFailed(e.getMessage(), clock.instant());
        } finally {
            if (timeout != null) {
                timeout.cancel(false);
            }
            if (!flight.claimLost && !job.isTerminal()) {
                job.tryMarkFailed("Interrupted before completion", clock.instant());
            }
            complete(flight);
        }
    }

    private void runAttempts(RuleDefinition rule, JobExecution job) {
        GeneratedQuery query;
        try {
            query = queryGenerator.generate(rule);
        } catch (RuleDefinitionException e) {
            log.warn("Job {} not runnable: {}", job.getJobId(), e.getMessage());
            job.tryMarkFailed(e.getMessage(), clock.instant());
            return;
        }
        job.attachQuery(query.getSql());

        QueryWindow window = QueryWindow.endingAt(job.getScheduledAt(), rule.getGranularity());
        Instant deadline = job.getStartedAt().plus(properties.getJobTimeout());

        while (job.tryBeginAttempt()) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                job.tryMarkTimedOut(timeoutMessage(), clock.instant());
                return;
            }
            try {
                List<AggregateRow> rows = backend.execute(query, window, remaining);
                if (job.tryMarkSucceeded(rows.size(), clock.instant())) {
                    recorder.recordResults(job, rows);
                }
                return;
            } catch (RuntimeException e) {
                if (job.isTerminal()) {
                    return;
                }
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                int attempt = job.getAttemptCount();
                if (attempt >= properties.getMaxRetries()) {
                    log.error("Job {} failed after {} attempts: {}", job.getJobId(), attempt, error);
                    job.tryMarkFailed(error, clock.instant());
                    return;
                }
                if (!job.tryMarkRetrying(error)) {
                    return;
                }
                long delayMs = backoff.apply(attempt);
                log.warn("Job {} attempt {}/{} failed, retrying in {} ms: {}",
                        job.getJobId(), attempt, properties.getMaxRetries(), delayMs, error);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void onTimeout(InFlightJob flight) {
        JobExecution job = flight.job;
        if (job.tryMarkTimedOut(timeoutMessage(), clock.instant())) {
            log.warn("Job {} timed out after {}", job.getJobId(), properties.getJobTimeout());
            flight.worker.cancel(true);
            complete(flight);
        }
    }

    private void cancelInFlight(String reason) {
        for (InFlightJob flight : new ArrayList<>(inFlight.values())) {
            if (flight.job.tryMarkFailed(reason, clock.instant())) {
                flight.worker.cancel(true);
                complete(flight);
            }
        }
    }

    /**
     * Record, report and release a job exactly once.
     */
    private void complete(InFlightJob flight) {
        if (!flight.done.compareAndSet(false, true)) {
            return;
        }
        JobExecution job = flight.job;
        inFlight.remove(job.getJobId());

        if (flight.claimLost) {
            flight.result.complete(readBack(job));
            return;
        }

        recorder.recordExecution(job);
        JobExecution snapshot = job.snapshot();

        Counter.builder("rule.jobs.executed")
                .tag("status", snapshot.getStatus().name())
                .register(meterRegistry)
                .increment();
        Timer.builder("rule.jobs.duration")
                .tag("status", snapshot.getStatus().name())
                .register(meterRegistry)
                .record(Duration.ofMillis(snapshot.getDurationMs()));

        flight.result.complete(snapshot);
    }

    private String timeoutMessage() {
        return "Job exceeded timeout of " + properties.getJobTimeout();
    }

    private static final class InFlightJob {
        final JobExecution job;
        final CompletableFuture<JobExecution> result = new CompletableFuture<>();
        final AtomicBoolean done = new AtomicBoolean();
        volatile FutureTask<Void> worker;
        volatile boolean claimLost;

        InFlightJob(JobExecution job) {
            this.job = job;
        }
    }
}
