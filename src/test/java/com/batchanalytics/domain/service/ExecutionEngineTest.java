package com.batchanalytics.domain.service;

import com.batchanalytics.config.SchedulerProperties;
import com.batchanalytics.config.StoreProperties;
import com.batchanalytics.domain.exception.ResultWriteException;
import com.batchanalytics.domain.model.AggregateRow;
import com.batchanalytics.domain.model.AggregationFunction;
import com.batchanalytics.domain.model.JobExecution;
import com.batchanalytics.domain.model.JobStatus;
import com.batchanalytics.domain.model.RuleCatalog;
import com.batchanalytics.domain.model.RuleDefinition;
import com.batchanalytics.domain.port.KpiQueryBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.TransientDataAccessResourceException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExecutionEngine against an in-memory store and a scripted backend.
 *
 * Retry delays and timeouts are shrunk to milliseconds; everything else runs for real,
 * threads included.
 */
class ExecutionEngineTest {

    private static final Instant SCHEDULED = Instant.parse("2024-03-01T09:00:00Z");

    private final RuleCatalog catalog = RuleCatalog.defaults();

    private SimpleMeterRegistry meterRegistry;
    private InMemoryRuleStore store;
    private SchedulerProperties properties;
    private StoreProperties storeProperties;
    private final List<ExecutionEngine> engines = new ArrayList<>();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryRuleStore();

        properties = new SchedulerProperties();
        properties.setMaxConcurrentJobs(4);
        properties.setMaxRetries(3);
        properties.setRetryDelay(Duration.ofMillis(10));
        properties.setJobTimeout(Duration.ofSeconds(10));

        storeProperties = new StoreProperties();
        storeProperties.setWriteAttempts(1);
        storeProperties.setWriteRetryDelay(Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        engines.forEach(engine -> engine.shutdown(Duration.ofSeconds(1)));
    }

    @Test
    void testExecute_Success() {
        // Given
        ExecutionEngine engine = engine((query, window, timeout) -> List.of(
                row("2024-03-01T08:00:00Z", "12.5"),
                row("2024-03-01T08:00:00Z", "13.5")));

        // When
        List<JobExecution> jobs = engine.execute(List.of(rule("r1", "du_metrics")), SCHEDULED);

        // Then
        assertEquals(1, jobs.size());
        JobExecution job = jobs.get(0);
        assertEquals(JobStatus.SUCCEEDED, job.getStatus());
        assertEquals(1, job.getAttemptCount());
        assertEquals(2, job.getRecordCount());
        assertEquals("SELECT date_trunc('hour', \"timestamp\") AS time_bucket, "
                + "AVG(CAST(\"cpu_usage\" AS NUMERIC)) AS \"avg_hour_cpu_usage\" FROM \"du_metrics\" "
                + "WHERE \"timestamp\" >= ? AND \"timestamp\" < ? GROUP BY time_bucket ORDER BY time_bucket",
                job.getGeneratedQuery());

        JobExecution stored = store.findJob("r1@2024-03-01T09:00:00Z").orElseThrow();
        assertEquals(JobStatus.SUCCEEDED, stored.getStatus());
        assertEquals(2, store.resultsFor(stored.getJobId()).size());
        assertEquals(1.0, meterRegistry.counter("rule.jobs.executed", "status", "SUCCEEDED").count());
    }

    @Test
    void testExecute_SucceedsOnLastAttempt() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        ExecutionEngine engine = engine((query, window, timeout) -> {
            if (calls.incrementAndGet() < properties.getMaxRetries()) {
                throw new TransientDataAccessResourceException("connection reset");
            }
            return List.of(row("2024-03-01T08:00:00Z", "1"));
        });

        // When
        JobExecution job = engine.execute(List.of(rule("r1", "du_metrics")), SCHEDULED).get(0);

        // Then
        assertEquals(JobStatus.SUCCEEDED, job.getStatus());
        assertEquals(properties.getMaxRetries(), job.getAttemptCount());
        assertNull(job.getErrorMessage());
    }

    @Test
    void testExecute_FailsAfterMaxRetries() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        ExecutionEngine engine = engine((query, window, timeout) -> {
            throw new TransientDataAccessResourceException("lock timeout #" + calls.incrementAndGet());
        });

        // When
        JobExecution job = engine.execute(List.of(rule("r1", "du_metrics")), SCHEDULED).get(0);

        // Then
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(3, job.getAttemptCount());
        assertEquals(3, calls.get());
        assertEquals("lock timeout #3", job.getErrorMessage());
        assertEquals(JobStatus.FAILED, store.findJob(job.getJobId()).orElseThrow().getStatus());
    }

    @Test
    void testExecute_TimesOutWithoutRetry() {
        // Given
        properties.setJobTimeout(Duration.ofMillis(300));
        AtomicInteger calls = new AtomicInteger();
        ExecutionEngine engine = engine((query, window, timeout) -> {
            calls.incrementAndGet();
            sleep(10_000);
            return List.of();
        });
        long start = System.currentTimeMillis();

        // When
        JobExecution job = engine.execute(List.of(rule("r1", "du_metrics")), SCHEDULED).get(0);

        // Then
        assertEquals(JobStatus.TIMED_OUT, job.getStatus());
        assertEquals(1, job.getAttemptCount());
        assertEquals(1, calls.get());
        assertTrue(System.currentTimeMillis() - start < 5_000);
        assertEquals(JobStatus.TIMED_OUT, store.findJob(job.getJobId()).orElseThrow().getStatus());
    }

    @Test
    void testExecute_BoundedConcurrency() {
        // Given
        properties.setMaxConcurrentJobs(2);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutionEngine engine = engine((query, window, timeout) -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            sleep(100);
            active.decrementAndGet();
            return List.of();
        });
        List<RuleDefinition> rules = List.of(
                rule("r1", "du_metrics"), rule("r2", "du_metrics"),
                rule("r3", "cu_metrics"), rule("r4", "cu_metrics"));

        // When
        List<JobExecution> jobs = engine.execute(rules, SCHEDULED);

        // Then
        assertEquals(4, jobs.size());
        assertTrue(jobs.stream().allMatch(j -> j.getStatus() == JobStatus.SUCCEEDED));
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void testExecute_FailureDoesNotAffectSiblings() {
        // Given
        properties.setMaxRetries(2);
        ExecutionEngine engine = engine((query, window, timeout) -> {
            if (query.getSql().contains("\"broken_table\"")) {
                throw new TransientDataAccessResourceException("relation does not exist");
            }
            return List.of(row("2024-03-01T08:00:00Z", "7"));
        });

        // When
        List<JobExecution> jobs = engine.execute(List.of(
                rule("good1", "du_metrics"), rule("bad", "broken_table"), rule("good2", "du_metrics")), SCHEDULED);

        // Then
        assertEquals(JobStatus.SUCCEEDED, jobs.get(0).getStatus());
        assertEquals(JobStatus.FAILED, jobs.get(1).getStatus());
        assertEquals(2, jobs.get(1).getAttemptCount());
        assertEquals(JobStatus.SUCCEEDED, jobs.get(2).getStatus());
    }

    @Test
    void testSubmit_SameInstantRunsOnce() throws Exception {
        // Given
        AtomicInteger calls = new AtomicInteger();
        KpiQueryBackend backend = (query, window, timeout) -> {
            calls.incrementAndGet();
            return List.of();
        };
        ExecutionEngine first = engine(backend);
        ExecutionEngine second = engine(backend);
        RuleDefinition r1 = rule("r1", "du_metrics");
        CountDownLatch go = new CountDownLatch(1);

        // When
        CompletableFuture<List<JobExecution>> a = CompletableFuture.supplyAsync(() -> {
            await(go);
            return first.execute(List.of(r1), SCHEDULED);
        });
        CompletableFuture<List<JobExecution>> b = CompletableFuture.supplyAsync(() -> {
            await(go);
            return second.execute(List.of(r1), SCHEDULED);
        });
        go.countDown();
        int jobs = a.get(10, TimeUnit.SECONDS).size() + b.get(10, TimeUnit.SECONDS).size();
        List<JobExecution> again = first.execute(List.of(r1), SCHEDULED.plusSeconds(30));

        // Then
        assertEquals(2, jobs);
        assertEquals(1, calls.get());
        assertEquals(1, again.size());
        assertEquals(JobStatus.SUCCEEDED, again.get(0).getStatus());
        assertEquals("r1@2024-03-01T09:00:00Z", again.get(0).getJobId());
        assertEquals(2.0, meterRegistry.counter("rule.jobs.duplicate").count());
    }

    @Test
    void testSubmit_StoreWriteFailureStillReturnsResult() throws Exception {
        // Given
        store = new InMemoryRuleStore() {
            @Override
            public boolean createPending(JobExecution job) {
                if (job.getRuleId().equals("r1")) {
                    throw new ResultWriteException(job.getJobId(), "Could not create job", null);
                }
                return super.createPending(job);
            }
        };
        AtomicInteger calls = new AtomicInteger();
        ExecutionEngine engine = engine((query, window, timeout) -> {
            calls.incrementAndGet();
            return List.of();
        });
        List<String> registered = new ArrayList<>();

        // When
        List<CompletableFuture<JobExecution>> futures = engine.submit(
                List.of(rule("r1", "du_metrics"), rule("r2", "du_metrics")), SCHEDULED,
                rule -> registered.add(rule.getRuleId()));

        // Then
        assertEquals(2, futures.size());
        JobExecution failed = futures.get(0).get(5, TimeUnit.SECONDS);
        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertTrue(failed.getErrorMessage().startsWith("Rule store unavailable"));
        assertEquals(0, failed.getAttemptCount());
        assertEquals(JobStatus.SUCCEEDED, futures.get(1).get(5, TimeUnit.SECONDS).getStatus());

        assertEquals(List.of("r2"), registered);
        assertEquals(1, calls.get());
        assertTrue(store.findJob("r1@2024-03-01T09:00:00Z").isEmpty());
        assertEquals(1.0, meterRegistry.counter("rule.store.write.failures", "kind", "create").count());
        assertEquals(1.0, meterRegistry.counter("rule.jobs.executed", "status", "FAILED").count());
    }

    @Test
    void testExecute_LostClaimIsNotRun() {
        // Given
        store = new InMemoryRuleStore() {
            @Override
            public boolean markClaimed(String jobId, Instant startedAt) {
                return false;
            }
        };
        AtomicInteger calls = new AtomicInteger();
        ExecutionEngine engine = engine((query, window, timeout) -> {
            calls.incrementAndGet();
            return List.of();
        });

        // When
        JobExecution job = engine.execute(List.of(rule("r1", "du_metrics")), SCHEDULED).get(0);

        // Then
        assertEquals(0, calls.get());
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(0.0, meterRegistry.counter("rule.jobs.executed", "status", "PENDING").count());
    }

    @Test
    void testShutdown_CancelsRunningAndQueuedJobs() throws Exception {
        // Given
        properties.setMaxConcurrentJobs(1);
        properties.setMaxRetries(1);
        CountDownLatch started = new CountDownLatch(1);
        ExecutionEngine engine = engine((query, window, timeout) -> {
            started.countDown();
            sleep(10_000);
            return List.of();
        });
        List<CompletableFuture<JobExecution>> futures = engine.submit(
                List.of(rule("r1", "du_metrics"), rule("r2", "du_metrics")), SCHEDULED);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // When
        engine.shutdown(Duration.ofMillis(100));

        // Then
        for (CompletableFuture<JobExecution> future : futures) {
            JobExecution job = future.get(5, TimeUnit.SECONDS);
            assertEquals(JobStatus.FAILED, job.getStatus());
            assertEquals(JobStatus.FAILED, store.findJob(job.getJobId()).orElseThrow().getStatus());
        }
        assertEquals(0, engine.getInFlightCount());

        List<CompletableFuture<JobExecution>> late = engine.submit(List.of(rule("r3", "du_metrics")), SCHEDULED);
        JobExecution rejected = late.get(0).get(5, TimeUnit.SECONDS);
        assertEquals(JobStatus.FAILED, rejected.getStatus());
        assertTrue(rejected.getErrorMessage().startsWith("Rejected"));
    }

    private ExecutionEngine engine(KpiQueryBackend backend) {
        ResultRecorder recorder = new ResultRecorder(store, storeProperties, meterRegistry);
        ExecutionEngine engine = new ExecutionEngine(new QueryGenerator(catalog, "timestamp"), backend, store,
                recorder, properties, Clock.systemUTC(), meterRegistry);
        engines.add(engine);
        return engine;
    }

    private RuleDefinition rule(String id, String table) {
        return RuleDefinition.builder()
                .ruleId(id)
                .tableName(table)
                .metricName("cpu_usage")
                .aggregation(AggregationFunction.AVG)
                .granularity(catalog.granularity("1-hour").orElseThrow())
                .scheduleName("EVERYHOUR")
                .build();
    }

    private static AggregateRow row(String bucket, String value) {
        return AggregateRow.builder()
                .timeBucket(Instant.parse(bucket))
                .aggregatedMetricName("avg_hour_cpu_usage")
                .value(new BigDecimal(value))
                .build();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
