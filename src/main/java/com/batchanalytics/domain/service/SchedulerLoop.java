package com.batchanalytics.domain.service;

import com.batchanalytics.config.SchedulerProperties;
import com.batchanalytics.domain.exception.StoreUnavailableException;
import com.batchanalytics.domain.model.ExecutionResult;
import com.batchanalytics.domain.model.JobExecution;
import com.batchanalytics.domain.model.JobStatus;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.model.TickReport;
import com.batchanalytics.domain.port.RuleStore;
import com.batchanalytics.infrastructure.cache.FiredInstantCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Top-level driver.
 *
 * Each tick:
 * 1. Load rules (store outage skips the tick, the loop keeps going)
 * 2. Ask the trigger engine which rules are due
 * 3. Hand the due rules to the execution engine
 * 4. Remember the fired instant of every rule whose job made it into the store
 * 5. Log each job's result as it completes
 *
 * Ticks run on a single thread and are aligned to multiples of the check interval.
 * A tick returns once its jobs are submitted, so long jobs never hold up the next tick,
 * and a slow tick simply delays the next one instead of stacking.
 */
@Slf4j
@Component
public class SchedulerLoop implements SmartLifecycle {

    private final RuleStore ruleStore;
    private final TriggerEngine triggerEngine;
    private final ExecutionEngine executionEngine;
    private final FiredInstantCache firedInstants;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final ThreadPoolTaskScheduler ticker;
    private volatile boolean running;

    public SchedulerLoop(RuleStore ruleStore,
                         TriggerEngine triggerEngine,
                         ExecutionEngine executionEngine,
                         FiredInstantCache firedInstants,
                         SchedulerProperties properties,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.ruleStore = ruleStore;
        this.triggerEngine = triggerEngine;
        this.executionEngine = executionEngine;
        this.firedInstants = firedInstants;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.ticker = new ThreadPoolTaskScheduler();
        this.ticker.setPoolSize(1);
        this.ticker.setThreadNamePrefix("scheduler-tick-");
        this.ticker.initialize();
        // a pending tick is dropped on shutdown, a running one finishes
        this.ticker.getScheduledThreadPoolExecutor().setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * Evaluate all rules at {@code now} and submit the due ones. Does not wait for jobs.
     */
    public TickReport tick(Instant now) {
        List<RuleDefinition> rules;
        try {
            rules = ruleStore.loadRules();
        } catch (StoreUnavailableException e) {
            log.error("Rule store unavailable, skipping tick at {}: {}", now, e.getMessage());
            countTick("store_unavailable");
            return TickReport.storeUnavailable(now);
        }

        Set<String> due = triggerEngine.dueRules(now, rules, lastFired(rules));
        Instant scheduledAt = now.truncatedTo(ChronoUnit.MINUTES);

        List<RuleDefinition> dueRules = rules.stream()
                .filter(rule -> due.contains(rule.getRuleId()))
                .toList();

        List<String> registered = new ArrayList<>();
        List<CompletableFuture<JobExecution>> jobs = dueRules.isEmpty()
                ? List.of()
                : executionEngine.submit(dueRules, scheduledAt, rule -> registered.add(rule.getRuleId()));
        markFired(registered, scheduledAt);
        jobs.forEach(job -> job.thenAccept(this::report));

        if (!dueRules.isEmpty()) {
            log.info("Tick {}: {} rules loaded, {} due, {} submitted", now, rules.size(), dueRules.size(), jobs.size());
        } else {
            log.debug("Tick {}: {} rules loaded, none due", now, rules.size());
        }
        countTick("ok");

        return TickReport.builder()
                .evaluatedAt(now)
                .scheduledAt(scheduledAt)
                .rulesLoaded(rules.size())
                .dueRuleIds(List.copyOf(due))
                .submitted(jobs.size())
                .storeUnavailable(false)
                .jobs(jobs)
                .build();
    }

    /**
     * One tick, then wait for every job it started.
     */
    public List<ExecutionResult> runOnce(Instant now) {
        TickReport report = tick(now);
        List<ExecutionResult> results = new ArrayList<>();
        for (CompletableFuture<JobExecution> job : report.getJobs()) {
            results.add(ExecutionResult.from(job.join()));
        }
        log.info("Run completed: {} jobs, {} succeeded", results.size(),
                results.stream().filter(r -> r.getStatus() == JobStatus.SUCCEEDED).count());
        return results;
    }

    /**
     * Fail jobs a crashed process left behind. Anything non-terminal for longer than
     * the job timeout plus the shutdown grace period cannot still be owned by a live worker.
     */
    @Scheduled(fixedDelayString = "${app.scheduler.recovery-interval-ms:300000}",
            initialDelayString = "${app.scheduler.recovery-interval-ms:300000}")
    public void recoverAbandonedJobs() {
        Instant cutoff = clock.instant()
                .minus(properties.getJobTimeout())
                .minus(properties.getShutdownGracePeriod())
                .minus(properties.getCheckInterval());
        try {
            int failed = ruleStore.failAbandoned(cutoff, "Abandoned: no live worker since " + cutoff);
            if (failed > 0) {
                log.warn("Marked {} abandoned jobs as FAILED", failed);
            }
        } catch (Exception e) {
            log.error("Error recovering abandoned jobs: {}", e.getMessage(), e);
        }
    }

    @Override
    public void start() {
        running = true;
        if (properties.getMode() != SchedulerProperties.Mode.CONTINUOUS) {
            log.info("Periodic ticks disabled (mode {})", properties.getMode());
            return;
        }
        log.info("Scheduler loop started, check interval {}, {} workers",
                properties.getCheckInterval(), properties.getMaxConcurrentJobs());
        scheduleNextTick();
    }

    @Override
    public void stop() {
        running = false;
        ScheduledThreadPoolExecutor tickThread = ticker.getScheduledThreadPoolExecutor();
        tickThread.shutdown();
        try {
            if (!tickThread.awaitTermination(properties.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                tickThread.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tickThread.shutdownNow();
        }
        executionEngine.shutdown(properties.getShutdownGracePeriod());
        log.info("Scheduler loop stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void scheduleNextTick() {
        if (!running || properties.getMode() != SchedulerProperties.Mode.CONTINUOUS) {
            return;
        }
        long intervalMs = properties.getCheckInterval().toMillis();
        long nowMs = clock.millis();
        long delayMs = intervalMs - (nowMs % intervalMs);
        try {
            ticker.schedule(this::tickAndReschedule, ticker.getClock().instant().plusMillis(delayMs));
        } catch (RejectedExecutionException e) {
            log.debug("Ticker shut down, no further ticks");
        }
    }

    private void tickAndReschedule() {
        try {
            tick(clock.instant());
        } catch (Exception e) {
            log.error("Tick failed: {}", e.getMessage(), e);
            countTick("error");
        } finally {
            scheduleNextTick();
        }
    }

    private Map<String, Instant> lastFired(List<RuleDefinition> rules) {
        List<String> ruleIds = rules.stream().map(RuleDefinition::getRuleId).toList();
        try {
            return firedInstants.lastFired(ruleIds);
        } catch (RuntimeException e) {
            log.warn("Fired instants unavailable, evaluating from the store only: {}", e.getMessage());
            return Map.of();
        }
    }

    private void markFired(List<String> ruleIds, Instant scheduledAt) {
        if (ruleIds.isEmpty()) {
            return;
        }
        try {
            firedInstants.markFired(ruleIds, scheduledAt);
        } catch (RuntimeException e) {
            log.warn("Could not remember {} fired instants for {}: {}", ruleIds.size(), scheduledAt, e.getMessage());
        }
    }

    private void report(JobExecution job) {
        ExecutionResult result = ExecutionResult.from(job);
        if (!result.getStatus().isTerminal()) {
            log.debug("Job {} is {} and owned elsewhere", result.getJobId(), result.getStatus());
            return;
        }
        if (result.getStatus() == JobStatus.SUCCEEDED) {
            log.info("Job {} SUCCEEDED: table={}, metric={}, records={}, attempts={} ({} ms)",
                    result.getJobId(), result.getTableName(), result.getMetricName(),
                    result.getRecordCount(), result.getAttemptCount(), result.getDurationMs());
        } else {
            log.warn("Job {} {}: table={}, metric={}, attempts={}, error={}",
                    result.getJobId(), result.getStatus(), result.getTableName(), result.getMetricName(),
                    result.getAttemptCount(), result.getErrorMessage());
        }
        log.debug("Job {} query: {}", result.getJobId(), result.getGeneratedSqlQuery());
    }

    private void countTick(String result) {
        Counter.builder("scheduler.ticks")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
